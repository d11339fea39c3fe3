package io.syncbeat.core;

import io.syncbeat.JobHandler;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

public class JobHandlerRegistry {

    private final Map<String, JobHandler> handlersByName;

    public JobHandlerRegistry(List<JobHandler> handlers) {
        this.handlersByName = handlers.stream()
                .collect(Collectors.toUnmodifiableMap(
                        JobHandler::name,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate JobHandler name: " + a.name());
                        }
                ));
    }

    public Optional<JobHandler> find(String task) {
        return Optional.ofNullable(handlersByName.get(task));
    }

    public Set<String> taskNames() {
        return handlersByName.keySet();
    }
}
