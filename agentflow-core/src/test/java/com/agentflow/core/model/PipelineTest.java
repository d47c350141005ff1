package com.agentflow.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineTest {

    private static Pipeline pipeline(List<PipelineStatus> statuses, List<Transition> transitions) {
        return new Pipeline("p1", "Test", null, "task", statuses, transitions);
    }

    @Test
    @DisplayName("findTransition matches exactly on from, to and trigger")
    void findTransition_exactMatch() {
        Pipeline p = pipeline(
            List.of(
                PipelineStatus.of("open", StatusCategory.READY, false),
                PipelineStatus.of("done", StatusCategory.TERMINAL, true)),
            List.of(Transition.onOutcome("open", "done", "approved")));

        assertThat(p.findTransition("open", "done", TransitionTrigger.AGENT)).isPresent();
        assertThat(p.findTransition("open", "done", TransitionTrigger.MANUAL)).isEmpty();
        assertThat(p.findTransition("done", "open", TransitionTrigger.AGENT)).isEmpty();
    }

    @Test
    @DisplayName("first declared transition wins when edges are duplicated")
    void findTransition_firstDeclaredWins() {
        Transition first = new Transition("open", "done", TransitionTrigger.MANUAL,
            List.of(), List.of(), "first", null);
        Transition second = new Transition("open", "done", TransitionTrigger.MANUAL,
            List.of(), List.of(), "second", null);
        Pipeline p = pipeline(
            List.of(
                PipelineStatus.of("open", StatusCategory.READY, false),
                PipelineStatus.of("done", StatusCategory.TERMINAL, true)),
            List.of(first, second));

        assertThat(p.findTransition("open", "done", TransitionTrigger.MANUAL))
            .get()
            .extracting(Transition::label)
            .isEqualTo("first");
    }

    @Test
    void transitionsFrom_filtersByTrigger() {
        Pipeline p = pipeline(
            List.of(
                PipelineStatus.of("open", StatusCategory.READY, false),
                PipelineStatus.of("planning", StatusCategory.AGENT_RUNNING, false),
                PipelineStatus.of("done", StatusCategory.TERMINAL, true)),
            List.of(
                Transition.manual("open", "planning"),
                Transition.onOutcome("open", "done", "no_changes"),
                Transition.manual("planning", "done")));

        assertThat(p.transitionsFrom("open", null)).hasSize(2);
        assertThat(p.transitionsFrom("open", TransitionTrigger.MANUAL))
            .extracting(Transition::to)
            .containsExactly("planning");
    }

    @Test
    void initialStatus_usesLowestPosition() {
        Pipeline p = pipeline(
            List.of(
                new PipelineStatus("done", "Done", StatusCategory.TERMINAL, true, 2),
                new PipelineStatus("open", "Open", StatusCategory.READY, false, 0)),
            List.of());

        assertThat(p.initialStatus()).isEqualTo("open");
        assertThat(p.isFinalStatus("done")).isTrue();
        assertThat(p.isFinalStatus("open")).isFalse();
        assertThat(p.isFinalStatus("missing")).isFalse();
    }

    @Test
    void initialStatus_withoutStatuses_shouldThrow() {
        Pipeline p = pipeline(List.of(), List.of());

        assertThatThrownBy(p::initialStatus).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void transition_defaultsTriggerToManual() {
        Transition t = new Transition("a", "b", null, null, null, null, null);

        assertThat(t.trigger()).isEqualTo(TransitionTrigger.MANUAL);
        assertThat(t.guards()).isEmpty();
        assertThat(t.hooks()).isEmpty();
    }

    @Test
    void hook_withoutPolicy_isBestEffort() {
        TransitionHook hook = new TransitionHook(HookKind.NOTIFY, null, null);

        assertThat(hook.effectivePolicy()).isEqualTo(HookPolicy.BEST_EFFORT);
    }
}
