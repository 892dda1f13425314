package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.exception.ErrorCode;
import com.autonomous.orchestrator.exception.OrchestratorException;
import com.autonomous.orchestrator.model.Project;
import com.autonomous.orchestrator.storage.InMemoryObjectStore;
import com.autonomous.orchestrator.storage.StorageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RegistryServiceTest {

    @TempDir
    Path tempDir;

    private RegistryService registry;

    @BeforeEach
    void setUp() {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.getStorage().setRetryBackoff(Duration.ZERO);
        properties.getRegistry().setSeedPath(tempDir.toString());
        registry = new RegistryService(new StorageService(new InMemoryObjectStore(), properties), properties);
    }

    @Test
    void shouldImportSnakeCaseSeeds() throws IOException {
        Files.writeString(tempDir.resolve("demo.yaml"),
            "id: demo\n" +
            "name: Demo Project\n" +
            "repo_url: https://github.com/example/demo.git\n" +
            "default_branch: develop\n" +
            "installation_id: \"42\"\n");
        Files.writeString(tempDir.resolve("notes.txt"), "ignored");

        assertEquals(1, registry.importSeeds());

        Project demo = registry.requireProject("demo");
        assertEquals("Demo Project", demo.getName());
        assertEquals("https://github.com/example/demo.git", demo.getRepoUrl());
        assertEquals("develop", demo.getDefaultBranch());
        assertEquals("42", demo.getInstallationId());
        assertTrue(demo.isEnabled());
        assertNotNull(demo.getCreatedAt());
    }

    @Test
    void seedsShouldNotOverwriteRegisteredProjects() throws IOException {
        registry.upsert(Project.builder().id("demo").name("Edited").repoUrl("https://x/demo.git").build());
        Files.writeString(tempDir.resolve("demo.yml"), "id: demo\nname: From Seed\nrepo_url: https://y/demo.git\n");

        assertEquals(0, registry.importSeeds());
        assertEquals("Edited", registry.requireProject("demo").getName());
    }

    @Test
    void badSeedFilesShouldBeSkipped() throws IOException {
        Files.writeString(tempDir.resolve("broken.yaml"), "id:\n  nested: map\n");
        Files.writeString(tempDir.resolve("noid.yaml"), "name: Nameless\n");
        Files.writeString(tempDir.resolve("ok.yaml"), "id: ok\nrepo_url: https://x/ok.git\n");

        assertEquals(1, registry.importSeeds());
        assertEquals(List.of("ok"), registry.listProjects().stream().map(Project::getId).toList());
    }

    @Test
    void missingSeedDirectoryShouldImportNothing() {
        registry.setSeedPath(tempDir.resolve("absent").toString());

        assertEquals(0, registry.importSeeds());
    }

    @Test
    void validateShouldRejectUnknownProject() {
        OrchestratorException e = assertThrows(OrchestratorException.class,
            () -> registry.validateForExecution("ghost"));

        assertEquals(ErrorCode.E001, e.getCode());
    }

    @Test
    void validateShouldRejectDisabledProject() {
        registry.upsert(project("demo", "1"));
        registry.disable("demo");

        OrchestratorException e = assertThrows(OrchestratorException.class,
            () -> registry.validateForExecution("demo"));

        assertEquals(ErrorCode.E002, e.getCode());
    }

    @Test
    void validateShouldRequireInstallation() {
        registry.upsert(project("demo", null));

        OrchestratorException e = assertThrows(OrchestratorException.class,
            () -> registry.validateForExecution("demo"));

        assertEquals(ErrorCode.E005, e.getCode());
    }

    @Test
    void validateShouldReturnUsableProject() {
        registry.upsert(project("demo", "1"));
        registry.disable("demo");
        registry.enable("demo");

        assertEquals("demo", registry.validateForExecution("demo").getId());
        assertEquals(1, registry.listEnabled().size());
    }

    @Test
    void upsertShouldKeepCreationTime() {
        Project first = registry.upsert(project("demo", "1"));
        Project second = registry.upsert(project("demo", "2"));

        assertEquals(first.getCreatedAt(), second.getCreatedAt());
        assertEquals("2", registry.requireProject("demo").getInstallationId());
        assertEquals(1, registry.listProjects().size());
    }

    @Test
    void removeShouldReportWhetherProjectExisted() {
        registry.upsert(project("demo", "1"));

        assertTrue(registry.remove("demo"));
        assertFalse(registry.remove("demo"));
        assertTrue(registry.getProject("demo").isEmpty());
    }

    @Test
    void enableUnknownProjectShouldFail() {
        OrchestratorException e = assertThrows(OrchestratorException.class, () -> registry.enable("ghost"));

        assertEquals(ErrorCode.E001, e.getCode());
    }

    private static Project project(String id, String installationId) {
        return Project.builder()
            .id(id)
            .name(id)
            .repoUrl("https://github.com/example/" + id + ".git")
            .installationId(installationId)
            .build();
    }
}
