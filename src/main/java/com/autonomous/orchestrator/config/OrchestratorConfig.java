package com.autonomous.orchestrator.config;

import com.autonomous.orchestrator.storage.FileObjectStore;
import com.autonomous.orchestrator.storage.InMemoryObjectStore;
import com.autonomous.orchestrator.storage.ObjectStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Slf4j
@Configuration
public class OrchestratorConfig {

    @Bean
    public ObjectStore objectStore(OrchestratorProperties properties) {
        OrchestratorProperties.Storage storage = properties.getStorage();
        if ("memory".equalsIgnoreCase(storage.getType())) {
            log.warn("Using in-memory storage; sessions will not survive a restart");
            return new InMemoryObjectStore();
        }
        log.info("Using filesystem storage at {}", storage.getRoot());
        return new FileObjectStore(Paths.get(storage.getRoot()));
    }

    // Session loops mostly wait on agent output, so one thread each.
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService sessionExecutor() {
        return Executors.newCachedThreadPool();
    }
}
