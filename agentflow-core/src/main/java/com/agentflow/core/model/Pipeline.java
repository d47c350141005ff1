package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Optional;

/**
 * Declarative lifecycle for one task type. Pipelines are configuration:
 * created and replaced administratively, never mutated by the engine.
 *
 * Primary Key: id
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Pipeline(
    String id,
    String name,
    String description,
    String taskType,
    List<PipelineStatus> statuses,
    List<Transition> transitions
) {
    public Pipeline {
        statuses = statuses == null ? List.of() : List.copyOf(statuses);
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
    }

    public boolean hasStatus(String statusName) {
        return findStatus(statusName).isPresent();
    }

    public Optional<PipelineStatus> findStatus(String statusName) {
        return statuses.stream().filter(s -> s.name().equals(statusName)).findFirst();
    }

    public boolean isFinalStatus(String statusName) {
        return findStatus(statusName).map(PipelineStatus::isFinal).orElse(false);
    }

    /**
     * The status a new task starts in: lowest position, first declared on ties.
     */
    public String initialStatus() {
        PipelineStatus initial = null;
        for (PipelineStatus status : statuses) {
            if (initial == null || status.position() < initial.position()) {
                initial = status;
            }
        }
        if (initial == null) {
            throw new IllegalStateException("Pipeline " + id + " declares no statuses");
        }
        return initial.name();
    }

    /**
     * Exact match on (from, to, trigger). When several edges match, the
     * first declared wins.
     */
    public Optional<Transition> findTransition(String from, String to, TransitionTrigger trigger) {
        return transitions.stream()
            .filter(t -> t.matches(from, to, trigger))
            .findFirst();
    }

    /**
     * Outgoing transitions of a status, optionally restricted to one trigger.
     */
    public List<Transition> transitionsFrom(String from, TransitionTrigger trigger) {
        return transitions.stream()
            .filter(t -> t.from().equals(from))
            .filter(t -> trigger == null || t.trigger() == trigger)
            .toList();
    }
}
