package com.agentflow.engine.coordinator;

import com.agentflow.core.exception.NotFoundException;
import com.agentflow.core.exception.PromptNotPendingException;
import com.agentflow.core.model.*;
import com.agentflow.core.repository.PendingPromptRepository;
import com.agentflow.core.repository.TaskRepository;
import com.agentflow.engine.logging.LoggingContext;
import com.agentflow.engine.logging.TaskEventRecorder;
import com.agentflow.engine.service.PipelineService;
import com.agentflow.engine.service.PromptService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Resolves prompts raised by agents and resumes the task.
 */
public class PromptCoordinator implements PromptService {

    private static final Logger log = LoggerFactory.getLogger(PromptCoordinator.class);

    private final PendingPromptRepository promptRepository;
    private final TaskRepository taskRepository;
    private final PipelineService pipelineService;
    private final TaskEventRecorder recorder;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public PromptCoordinator(
            PendingPromptRepository promptRepository,
            TaskRepository taskRepository,
            PipelineService pipelineService,
            TaskEventRecorder recorder,
            ObjectMapper objectMapper,
            Clock clock) {
        this.promptRepository = promptRepository;
        this.taskRepository = taskRepository;
        this.pipelineService = pipelineService;
        this.recorder = recorder;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public PendingPrompt getPrompt(String promptId) {
        return promptRepository.findById(promptId)
            .orElseThrow(() -> new NotFoundException("Prompt", promptId));
    }

    @Override
    public List<PendingPrompt> listPrompts(String taskId) {
        return promptRepository.findByTask(taskId);
    }

    @Override
    public TransitionResult respond(String promptId, JsonNode response) {
        PendingPrompt prompt = getPrompt(promptId);
        if (!prompt.isPending()) {
            throw new PromptNotPendingException(promptId, prompt.status().value());
        }
        // Conditional write; a concurrent answer or expiry wins the race
        if (!promptRepository.answer(promptId, response, clock.instant())) {
            throw new PromptNotPendingException(promptId, getPrompt(promptId).status().value());
        }

        try (LoggingContext lc = LoggingContext.forRun(prompt.taskId(), prompt.agentRunId())) {
            recorder.activity("prompt_response", "task", prompt.taskId(), "Responded to agent prompt",
                TaskEventRecorder.data("promptId", promptId, "promptType", prompt.promptType()));
            recorder.info(prompt.taskId(), EventCategory.PROMPT, "Prompt answered: " + prompt.promptType(),
                TaskEventRecorder.data("promptId", promptId, "response", response));
            log.info("Prompt {} answered", promptId);

            Task task = taskRepository.findById(prompt.taskId())
                .orElseThrow(() -> new NotFoundException("Task", prompt.taskId()));
            return resume(task, prompt, response);
        }
    }

    /**
     * Prefer the transition that returns the task to where it was when the prompt was raised.
     */
    private TransitionResult resume(Task task, PendingPrompt prompt, JsonNode response) {
        List<Transition> candidates = pipelineService.getValidTransitions(task, TransitionTrigger.AGENT).stream()
            .filter(t -> t.agentOutcome() != null && t.agentOutcome().equals(prompt.resumeOutcome()))
            .toList();
        String resumeTo = prompt.resumeToStatus();
        Optional<Transition> match = candidates.stream()
            .filter(t -> t.to().equals(resumeTo))
            .findFirst()
            .or(() -> candidates.stream().findFirst());

        if (match.isEmpty()) {
            log.warn("No transition for resume outcome {} from status {}", prompt.resumeOutcome(), task.status());
            recorder.warning(task.id(), EventCategory.SYSTEM, String.format(
                    "No transition found for resumeOutcome \"%s\" from status \"%s\"",
                    prompt.resumeOutcome(), task.status()),
                TaskEventRecorder.data(
                    "promptId", prompt.id(),
                    "resumeOutcome", prompt.resumeOutcome(),
                    "currentStatus", task.status()));
            return null;
        }

        ObjectNode data = objectMapper.createObjectNode();
        data.put("outcome", prompt.resumeOutcome());
        data.put("promptId", prompt.id());
        if (response != null) {
            data.set("response", response);
        }
        return pipelineService.executeTransition(task, match.get().to(),
            new TransitionContext(TransitionTrigger.AGENT, "prompt:" + prompt.id(), data));
    }
}
