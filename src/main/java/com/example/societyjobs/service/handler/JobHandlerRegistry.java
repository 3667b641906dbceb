package com.example.societyjobs.service.handler;

import com.example.societyjobs.domain.enums.JobType;
import com.example.societyjobs.exception.JobNotRegisteredException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Registry for job handlers.
 * <p>
 * Automatically discovers all JobHandler beans.
 * Provides lookup by job name.
 */
@Slf4j
@Component
public class JobHandlerRegistry {

    private final Map<String, JobHandler> handlers = new LinkedHashMap<>();
    private final List<JobHandler> handlerBeans;

    public JobHandlerRegistry(List<JobHandler> handlerBeans) {
        this.handlerBeans = handlerBeans;
    }

    @PostConstruct
    public void initialize() {
        for (var handler : handlerBeans) {
            var name = handler.getJobName();
            if (handlers.containsKey(name)) {
                log.warn("Duplicate handler for job {}: {} will override {}",
                        name, handler.getClass().getSimpleName(),
                        handlers.get(name).getClass().getSimpleName());
            }
            handlers.put(name, handler);
            log.info("Registered handler for job {}: {}", name, handler.getClass().getSimpleName());
        }

        for (var type : JobType.values()) {
            if (!handlers.containsKey(type.getCode())) {
                log.warn("No handler registered for job: {}", type.getCode());
            }
        }
    }

    /**
     * Get handler for a job name
     *
     * @param jobName The job name
     * @return Optional containing the handler if found
     */
    public Optional<JobHandler> getHandler(String jobName) {
        return Optional.ofNullable(handlers.get(jobName));
    }

    /**
     * Get handler for a job name, throwing if not found
     *
     * @throws JobNotRegisteredException if no handler is registered
     */
    public JobHandler getHandlerOrThrow(String jobName) {
        return getHandler(jobName).orElseThrow(() -> new JobNotRegisteredException(jobName));
    }

    public boolean hasHandler(String jobName) {
        return handlers.containsKey(jobName);
    }

    /**
     * All handlers in registration order
     */
    public Collection<JobHandler> getHandlers() {
        return Collections.unmodifiableCollection(handlers.values());
    }

    public int getHandlerCount() {
        return handlers.size();
    }
}
