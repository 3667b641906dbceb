package com.example.societyjobs.service.registry;

import com.example.societyjobs.exception.JobNotRegisteredException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds a descriptor for every job known to this process.
 * <p>
 * Descriptors are created once at startup by JobManagementService and live
 * until shutdown. Safe for concurrent use by overlapping triggers.
 */
@Slf4j
@Component
public class JobRegistry {

    private final Map<String, JobDescriptor> descriptors = new ConcurrentHashMap<>();

    /**
     * Register a job. Registering an existing name keeps its current state.
     */
    public JobDescriptor register(String name) {
        return descriptors.computeIfAbsent(name, key -> {
            log.info("Registered job {}", key);
            return new JobDescriptor(key);
        });
    }

    public Optional<JobDescriptor> find(String name) {
        return Optional.ofNullable(descriptors.get(name));
    }

    /**
     * @throws JobNotRegisteredException if the name was never registered
     */
    public JobDescriptor getOrThrow(String name) {
        return find(name).orElseThrow(() -> new JobNotRegisteredException(name));
    }

    public boolean isRegistered(String name) {
        return descriptors.containsKey(name);
    }

    /**
     * All descriptors ordered by name
     */
    public List<JobDescriptor> getAll() {
        return descriptors.values().stream()
                .sorted(Comparator.comparing(JobDescriptor::getName))
                .toList();
    }

    public int size() {
        return descriptors.size();
    }

    /**
     * Drop every descriptor. Used on shutdown.
     */
    public void clear() {
        descriptors.values().forEach(JobDescriptor::reset);
        descriptors.clear();
        log.info("Job registry cleared");
    }
}
