package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.exception.ErrorCode;
import com.autonomous.orchestrator.exception.OrchestratorException;
import com.autonomous.orchestrator.model.Project;
import com.autonomous.orchestrator.model.ProjectRegistry;
import com.autonomous.orchestrator.storage.StorageService;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Registered target projects. The orchestrator only reads the registry;
 * the write operations here back the admin endpoints and seed import.
 */
@Slf4j
@Service
public class RegistryService {

    private final StorageService storage;
    private final ObjectMapper yamlMapper;
    private String seedPath;

    public RegistryService(StorageService storage, OrchestratorProperties properties) {
        this.storage = storage;
        this.seedPath = properties.getRegistry().getSeedPath();
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.yamlMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public void setSeedPath(String path) {
        this.seedPath = path;
    }

    @PostConstruct
    public void loadSeeds() {
        importSeeds();
    }

    /**
     * Adds projects from {@code *.yaml} / {@code *.yml} seed files that are not
     * registered yet. Registered projects are left as they are, so edits made
     * through the admin API survive a restart.
     *
     * @return number of projects added
     */
    public synchronized int importSeeds() {
        File seedDir = new File(seedPath);
        if (!seedDir.isDirectory()) {
            log.info("No project seed directory at {}", seedPath);
            return 0;
        }

        File[] yamlFiles = seedDir.listFiles((dir, name) -> name.endsWith(".yaml") || name.endsWith(".yml"));
        if (yamlFiles == null || yamlFiles.length == 0) {
            return 0;
        }
        Arrays.sort(yamlFiles);

        ProjectRegistry registry = storage.getRegistry();
        int added = 0;
        for (File file : yamlFiles) {
            Project project;
            try {
                project = yamlMapper.readValue(file, Project.class);
            } catch (IOException e) {
                log.warn("Skipping project seed {}: {}", file.getName(), e.getMessage());
                continue;
            }
            if (project.getId() == null || project.getId().isBlank()) {
                log.warn("Skipping project seed {}: no id", file.getName());
                continue;
            }
            if (registry.find(project.getId()).isPresent()) {
                continue;
            }
            stamp(project, null);
            registry.getProjects().add(project);
            added++;
            log.info("Registered project {} from {}", project.getId(), file.getName());
        }

        if (added > 0) {
            storage.saveRegistry(registry);
        }
        return added;
    }

    public List<Project> listProjects() {
        return storage.getRegistry().getProjects().stream()
            .sorted(Comparator.comparing(Project::getId))
            .collect(Collectors.toList());
    }

    public List<Project> listEnabled() {
        return listProjects().stream().filter(Project::isEnabled).collect(Collectors.toList());
    }

    public Optional<Project> getProject(String id) {
        return storage.getRegistry().find(id);
    }

    public Project requireProject(String id) {
        return getProject(id).orElseThrow(() -> new OrchestratorException(ErrorCode.E001, "Unknown project `" + id + "`"));
    }

    /**
     * Checks that a project may run sessions: it exists, is enabled and has
     * a VCS installation to open pull requests with.
     */
    public Project validateForExecution(String id) {
        Project project = requireProject(id);
        if (!project.isEnabled()) {
            throw new OrchestratorException(ErrorCode.E002, "Project `" + id + "` is disabled");
        }
        if (project.getInstallationId() == null || project.getInstallationId().isBlank()) {
            throw new OrchestratorException(ErrorCode.E005, "Project `" + id + "` has no VCS installation");
        }
        return project;
    }

    public synchronized Project upsert(Project project) {
        if (project.getId() == null || project.getId().isBlank()) {
            throw new IllegalArgumentException("Project id is required");
        }
        ProjectRegistry registry = storage.getRegistry();
        Optional<Project> existing = registry.find(project.getId());
        existing.ifPresent(registry.getProjects()::remove);
        stamp(project, existing.orElse(null));
        registry.getProjects().add(project);
        storage.saveRegistry(registry);
        log.info("{} project {}", existing.isPresent() ? "Updated" : "Added", project.getId());
        return project;
    }

    public Project enable(String id) {
        return setEnabled(id, true);
    }

    public Project disable(String id) {
        return setEnabled(id, false);
    }

    public synchronized boolean remove(String id) {
        ProjectRegistry registry = storage.getRegistry();
        Optional<Project> existing = registry.find(id);
        if (existing.isEmpty()) {
            return false;
        }
        registry.getProjects().remove(existing.get());
        storage.saveRegistry(registry);
        log.info("Removed project {}", id);
        return true;
    }

    private synchronized Project setEnabled(String id, boolean enabled) {
        ProjectRegistry registry = storage.getRegistry();
        Project project = registry.find(id)
            .orElseThrow(() -> new OrchestratorException(ErrorCode.E001, "Unknown project `" + id + "`"));
        project.setEnabled(enabled);
        project.setUpdatedAt(Instant.now());
        storage.saveRegistry(registry);
        log.info("Project {} {}", id, enabled ? "enabled" : "disabled");
        return project;
    }

    private static void stamp(Project project, Project previous) {
        Instant now = Instant.now();
        project.setCreatedAt(previous != null && previous.getCreatedAt() != null ? previous.getCreatedAt() : now);
        project.setUpdatedAt(now);
        if (project.getName() == null) {
            project.setName(project.getId());
        }
        if (project.getDefaultBranch() == null) {
            project.setDefaultBranch("main");
        }
    }
}
