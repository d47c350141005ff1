package com.agentflow.engine.outcome;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps outcome names to their expected payload shape.
 */
public class OutcomeSchemaRegistry {

    public static final String NEEDS_INFO = "needs_info";
    public static final String PR_READY = "pr_ready";
    public static final String FAILED = "failed";
    public static final String INTERRUPTED = "interrupted";
    public static final String INFO_PROVIDED = "info_provided";

    private final Map<String, OutcomeDefinition> definitions = new LinkedHashMap<>();

    /**
     * Registry with the built-in outcomes.
     */
    public static OutcomeSchemaRegistry defaults() {
        OutcomeSchemaRegistry registry = new OutcomeSchemaRegistry();
        registry.register(new OutcomeDefinition(NEEDS_INFO,
            "Agent needs additional information from the user",
            fields("questions", PayloadType.ARRAY)));
        registry.register(new OutcomeDefinition("options_proposed",
            "Agent is presenting options for the user to choose from",
            fields("summary", PayloadType.STRING, "options", PayloadType.ARRAY)));
        registry.register(new OutcomeDefinition("changes_requested",
            "Review found issues that need to be addressed",
            fields("summary", PayloadType.STRING, "comments", PayloadType.ARRAY)));
        registry.register(OutcomeDefinition.signal(FAILED, "Agent execution failed"));
        registry.register(OutcomeDefinition.signal(INTERRUPTED, "Agent run interrupted by shutdown or supervisor"));
        registry.register(OutcomeDefinition.signal("no_changes", "Agent completed but made no changes"));
        registry.register(OutcomeDefinition.signal("conflicts_detected", "Merge conflicts detected on branch"));
        registry.register(OutcomeDefinition.signal("plan_complete", "Planning finished"));
        registry.register(OutcomeDefinition.signal("investigation_complete", "Investigation finished"));
        registry.register(OutcomeDefinition.signal(PR_READY, "Implementation done, ready for a pull request"));
        registry.register(OutcomeDefinition.signal("approved", "Review passed"));
        registry.register(OutcomeDefinition.signal("design_ready", "Design completed"));
        registry.register(OutcomeDefinition.signal("reproduced", "Bug reproduced"));
        registry.register(OutcomeDefinition.signal("cannot_reproduce", "Bug not reproducible"));
        registry.register(OutcomeDefinition.signal(INFO_PROVIDED, "A human answered the agent's questions"));
        return registry;
    }

    public void register(OutcomeDefinition definition) {
        definitions.put(definition.name(), definition);
    }

    public Optional<OutcomeDefinition> find(String outcome) {
        return Optional.ofNullable(definitions.get(outcome));
    }

    public Collection<OutcomeDefinition> all() {
        return Collections.unmodifiableCollection(definitions.values());
    }

    /**
     * Check a payload against the outcome's definition. Reports the first problem found.
     */
    public PayloadValidation validate(String outcome, JsonNode payload) {
        OutcomeDefinition definition = definitions.get(outcome);
        if (definition == null) {
            return PayloadValidation.invalid("Unknown outcome: \"" + outcome + "\"");
        }
        if (definition.isSignalOnly()) {
            return PayloadValidation.ok();
        }
        if (payload == null || !payload.isObject()) {
            return PayloadValidation.invalid("Outcome \"" + outcome + "\" requires an object payload");
        }
        for (Map.Entry<String, PayloadType> field : definition.requiredFields().entrySet()) {
            if (!payload.has(field.getKey())) {
                return PayloadValidation.invalid(String.format(
                    "Outcome \"%s\" payload missing required field: \"%s\"", outcome, field.getKey()));
            }
            if (!field.getValue().matches(payload.get(field.getKey()))) {
                return PayloadValidation.invalid(String.format(
                    "Outcome \"%s\" payload field \"%s\" must be %s",
                    outcome, field.getKey(), field.getValue().label()));
            }
        }
        return PayloadValidation.ok();
    }

    private static Map<String, PayloadType> fields(Object... namesAndTypes) {
        Map<String, PayloadType> fields = new LinkedHashMap<>();
        for (int i = 0; i + 1 < namesAndTypes.length; i += 2) {
            fields.put((String) namesAndTypes[i], (PayloadType) namesAndTypes[i + 1]);
        }
        return Collections.unmodifiableMap(fields);
    }
}
