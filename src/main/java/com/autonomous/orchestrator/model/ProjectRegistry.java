package com.autonomous.orchestrator.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Data
public class ProjectRegistry {
    public static final String CURRENT_VERSION = "1.0.0";

    private String version = CURRENT_VERSION;
    private List<Project> projects = new ArrayList<>();

    public Optional<Project> find(String id) {
        return projects.stream().filter(p -> p.getId().equals(id)).findFirst();
    }
}
