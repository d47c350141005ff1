package com.agentflow.core.model;

import com.agentflow.core.exception.PipelineConfigException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegistryKindTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void fromName_shouldResolveKnownNames() {
        assertThat(GuardKind.fromName("no_running_agent")).isEqualTo(GuardKind.NO_RUNNING_AGENT);
        assertThat(HookKind.fromName("start_agent")).isEqualTo(HookKind.START_AGENT);
    }

    @Test
    void fromName_unknownGuard_shouldRaiseConfigError() {
        assertThatThrownBy(() -> GuardKind.fromName("is_friday"))
            .isInstanceOf(PipelineConfigException.class)
            .hasMessageContaining("is_friday");
    }

    @Test
    void fromName_unknownHook_shouldRaiseConfigError() {
        assertThatThrownBy(() -> HookKind.fromName("send_fax"))
            .isInstanceOf(PipelineConfigException.class)
            .hasMessageContaining("send_fax");
    }

    @Test
    void guardReference_shouldDeserializeByName() throws Exception {
        TransitionGuard guard = mapper.readValue(
            "{\"name\":\"max_retries\",\"params\":{\"max\":2}}", TransitionGuard.class);

        assertThat(guard.kind()).isEqualTo(GuardKind.MAX_RETRIES);
        assertThat(guard.params()).containsEntry("max", 2);
    }

    @Test
    void hookReference_shouldDeserializePolicy() throws Exception {
        TransitionHook hook = mapper.readValue(
            "{\"name\":\"notify\",\"policy\":\"fire_and_forget\"}", TransitionHook.class);

        assertThat(hook.kind()).isEqualTo(HookKind.NOTIFY);
        assertThat(hook.effectivePolicy()).isEqualTo(HookPolicy.FIRE_AND_FORGET);
    }
}
