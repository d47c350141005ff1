package com.agentflow.engine.agent;

import com.agentflow.core.model.Subtask;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives a task plan and subtasks from a planning run.
 *
 * The payload's {@code plan}/{@code subtasks} fields win; otherwise the plan is
 * the raw output without tool-call lines, and subtasks come from a JSON block
 * under a "## Subtasks" heading.
 */
public class PlanExtractor {

    private static final Logger log = LoggerFactory.getLogger(PlanExtractor.class);

    public static final Set<String> PLAN_MODES = Set.of("plan", "plan_revision", "investigate");

    private static final Pattern BRACKETED_LINE = Pattern.compile("^\\[[\\w_]+\\] ");
    private static final Pattern BLANK_RUNS = Pattern.compile("\\n{3,}");
    private static final Pattern SUBTASKS_BLOCK = Pattern.compile(
        "## Subtasks\\s*\\n[\\s\\S]*?```(?:json)?\\s*\\n([\\s\\S]*?)```", Pattern.CASE_INSENSITIVE);

    private final ObjectMapper objectMapper;

    public PlanExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static boolean isPlanMode(String mode) {
        return PLAN_MODES.contains(mode);
    }

    /**
     * @return the extracted plan, or empty when the run produced nothing usable
     */
    public Optional<ExtractedPlan> extract(JsonNode payload, String output) {
        if (payload != null && payload.hasNonNull("plan") && !payload.get("plan").asText().isBlank()) {
            return Optional.of(new ExtractedPlan(payload.get("plan").asText(), subtasksFrom(payload.get("subtasks"))));
        }
        if (output == null) {
            return Optional.empty();
        }
        String plan = stripToolLines(output);
        if (plan.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ExtractedPlan(plan, subtasksFromOutput(output)));
    }

    static String stripToolLines(String output) {
        StringBuilder kept = new StringBuilder();
        for (String line : output.split("\n", -1)) {
            if (line.startsWith("> Tool: ") || line.startsWith("> Input: ")) {
                continue;
            }
            if (BRACKETED_LINE.matcher(line).find()) {
                continue;
            }
            if (kept.length() > 0) {
                kept.append('\n');
            }
            kept.append(line);
        }
        return BLANK_RUNS.matcher(kept.toString()).replaceAll("\n\n").trim();
    }

    List<Subtask> subtasksFromOutput(String output) {
        Matcher matcher = SUBTASKS_BLOCK.matcher(output);
        if (!matcher.find()) {
            return List.of();
        }
        try {
            return subtasksFrom(objectMapper.readTree(matcher.group(1).trim()));
        } catch (JsonProcessingException e) {
            log.debug("Ignoring unparseable subtasks block: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    /**
     * Accepts an array of names or of objects with a name field.
     */
    static List<Subtask> subtasksFrom(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<Subtask> subtasks = new ArrayList<>();
        for (JsonNode item : node) {
            if (item.isTextual()) {
                subtasks.add(Subtask.open(item.asText()));
            } else if (item.isObject() && item.hasNonNull("name")) {
                subtasks.add(Subtask.open(item.get("name").asText()));
            }
        }
        return subtasks;
    }

    /**
     * @param subtasks empty when the run did not propose any
     */
    public record ExtractedPlan(String plan, List<Subtask> subtasks) {
    }
}
