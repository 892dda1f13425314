package com.autonomous.orchestrator.controller;

import com.autonomous.orchestrator.exception.OrchestratorException;
import com.autonomous.orchestrator.model.Project;
import com.autonomous.orchestrator.service.RegistryService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Registry administration. Not exposed through chat.
 */
@RestController
@RequestMapping("/admin/projects")
public class AdminController {

    private final RegistryService registry;

    public AdminController(RegistryService registry) {
        this.registry = registry;
    }

    @GetMapping
    public List<Project> list() {
        return registry.listProjects();
    }

    @GetMapping("/{id}")
    public ResponseEntity<Project> get(@PathVariable String id) {
        return registry.getProject(id)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{id}")
    public Project upsert(@PathVariable String id, @RequestBody Project project) {
        project.setId(id);
        return registry.upsert(project);
    }

    @PostMapping("/{id}/enable")
    public Project enable(@PathVariable String id) {
        return registry.enable(id);
    }

    @PostMapping("/{id}/disable")
    public Project disable(@PathVariable String id) {
        return registry.disable(id);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> remove(@PathVariable String id) {
        return registry.remove(id) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    @ExceptionHandler(OrchestratorException.class)
    public ResponseEntity<Map<String, String>> handleOrchestratorException(OrchestratorException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
            "code", e.getCode().name(),
            "message", e.getMessage()
        ));
    }
}
