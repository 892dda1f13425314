package com.autonomous.orchestrator.controller;

import com.autonomous.orchestrator.exception.ErrorCode;
import com.autonomous.orchestrator.exception.OrchestratorException;
import com.autonomous.orchestrator.model.Project;
import com.autonomous.orchestrator.service.RegistryService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AdminController.class)
class AdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RegistryService registry;

    @Test
    void shouldListProjects() throws Exception {
        when(registry.listProjects()).thenReturn(List.of(project("demo")));

        mockMvc.perform(get("/admin/projects"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].id").value("demo"))
            .andExpect(jsonPath("$[0].enabled").value(true));
    }

    @Test
    void unknownProjectShouldBeNotFound() throws Exception {
        when(registry.getProject("ghost")).thenReturn(Optional.empty());

        mockMvc.perform(get("/admin/projects/ghost"))
            .andExpect(status().isNotFound());
    }

    @Test
    void putShouldUpsertUnderPathId() throws Exception {
        when(registry.upsert(any())).thenAnswer(invocation -> invocation.getArgument(0));

        mockMvc.perform(put("/admin/projects/demo")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"id\":\"other\",\"name\":\"Demo\",\"repoUrl\":\"https://github.com/example/demo.git\"," +
                    "\"installationId\":\"99\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value("demo"));

        ArgumentCaptor<Project> captor = ArgumentCaptor.forClass(Project.class);
        verify(registry).upsert(captor.capture());
        assertEquals("demo", captor.getValue().getId());
        assertEquals("99", captor.getValue().getInstallationId());
    }

    @Test
    void disableUnknownProjectShouldReportCode() throws Exception {
        when(registry.disable("ghost")).thenThrow(new OrchestratorException(ErrorCode.E001, "Unknown project `ghost`"));

        mockMvc.perform(post("/admin/projects/ghost/disable"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("E001"));
    }

    @Test
    void deleteShouldReflectWhetherProjectExisted() throws Exception {
        when(registry.remove("demo")).thenReturn(true);
        when(registry.remove("ghost")).thenReturn(false);

        mockMvc.perform(delete("/admin/projects/demo")).andExpect(status().isNoContent());
        mockMvc.perform(delete("/admin/projects/ghost")).andExpect(status().isNotFound());
    }

    private static Project project(String id) {
        return Project.builder().id(id).name(id).repoUrl("https://github.com/example/" + id + ".git").build();
    }
}
