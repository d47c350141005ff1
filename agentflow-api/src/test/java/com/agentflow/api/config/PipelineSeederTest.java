package com.agentflow.api.config;

import com.agentflow.core.model.GuardKind;
import com.agentflow.core.model.GuardResult;
import com.agentflow.core.model.HookKind;
import com.agentflow.core.model.HookResult;
import com.agentflow.core.model.Pipeline;
import com.agentflow.engine.guard.GuardRegistry;
import com.agentflow.engine.hook.HookRegistry;
import com.agentflow.engine.pipeline.PipelineValidator;
import com.agentflow.engine.service.PipelineService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Pipeline seeding")
class PipelineSeederTest {

    private PipelineService pipelineService;
    private AgentFlowProperties properties;
    private PipelineSeeder seeder;

    @BeforeEach
    void setUp() {
        pipelineService = mock(PipelineService.class);
        when(pipelineService.savePipeline(any())).thenAnswer(inv -> inv.getArgument(0));
        properties = new AgentFlowProperties();
        seeder = new PipelineSeeder(pipelineService, new ObjectMapper(), new DefaultResourceLoader(), properties);
    }

    @Test
    @DisplayName("Bundled pipelines are read and saved")
    void seedsBundledPipelines() {
        List<Pipeline> seeded = seeder.seed();

        assertThat(seeded)
            .extracting(Pipeline::id)
            .containsExactly("pipeline-simple", "pipeline-feature", "pipeline-bug", "pipeline-agent");
        verify(pipelineService, times(4)).savePipeline(any());

        Pipeline agent = seeded.get(3);
        assertThat(agent.isFinalStatus("done")).isTrue();
        assertThat(agent.transitionsFrom("needs_info", null))
            .extracting(t -> t.to())
            .containsExactlyInAnyOrder("planning", "implementing");
    }

    @Test
    @DisplayName("Every bundled pipeline passes validation against the built-in registries")
    void bundledPipelinesAreValid() {
        GuardRegistry guards = new GuardRegistry();
        for (GuardKind kind : GuardKind.values()) {
            guards.register(kind, (task, transition, context, params) -> GuardResult.allow());
        }
        HookRegistry hooks = new HookRegistry();
        for (HookKind kind : HookKind.values()) {
            hooks.register(kind, (task, transition, context, hook) -> HookResult.ok());
        }
        PipelineValidator validator = new PipelineValidator(guards, hooks);

        for (Pipeline pipeline : seeder.seed()) {
            assertThatCode(() -> validator.validate(pipeline)).doesNotThrowAnyException();
        }
    }

    @Test
    @DisplayName("A missing seed file seeds nothing")
    void missingSeedFile() {
        properties.getPipelines().setSeedLocation("classpath:pipelines/absent.json");

        assertThat(seeder.seed()).isEmpty();
        verify(pipelineService, never()).savePipeline(any());
    }
}
