package com.agentflow.engine.coordinator;

import com.agentflow.core.exception.NotFoundException;
import com.agentflow.core.model.*;
import com.agentflow.engine.service.TaskService.NewProject;
import com.agentflow.engine.service.TaskService.NewTask;
import com.agentflow.engine.support.EngineFixture;
import com.agentflow.engine.support.TestPipelines;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TaskCoordinatorTest {

    private EngineFixture fx;

    @BeforeEach
    void setUp() {
        fx = new EngineFixture();
        fx.pipelineService.savePipeline(TestPipelines.simple());
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Test
    @DisplayName("New tasks start in the pipeline's initial status")
    void createTask() {
        Project project = fx.createProject();

        Task task = fx.taskService.createTask(new NewTask(project.id(), "simple", "Fix flaky test", null, 2,
            List.of("ci", "tests"), "dana", null));

        assertThat(task.status()).isEqualTo("open");
        Task stored = fx.taskService.getTask(task.id());
        assertThat(stored.title()).isEqualTo("Fix flaky test");
        assertThat(stored.priority()).isEqualTo(2);
        assertThat(stored.tags()).containsExactly("ci", "tests");
        assertThat(stored.assignee()).isEqualTo("dana");
        assertThat(fx.taskService.listTasks(project.id())).extracting(Task::id).containsExactly(task.id());
        assertThat(fx.taskService.getEvents(task.id())).hasSize(1);
        assertThat(fx.activity.recent(5)).extracting(ActivityEntry::action).contains("task_created");
    }

    @Test
    @DisplayName("Tasks need a title, a known project and a known pipeline")
    void createTaskValidation() {
        Project project = fx.createProject();

        assertThatThrownBy(() -> fx.taskService.createTask(new NewTask(project.id(), "simple", " ", null, 0, null, null, null)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> fx.taskService.createTask(new NewTask("nope", "simple", "t", null, 0, null, null, null)))
            .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> fx.taskService.createTask(new NewTask(project.id(), "nope", "t", null, 0, null, null, null)))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Projects need a name")
    void createProjectValidation() {
        assertThatThrownBy(() -> fx.taskService.createProject(new NewProject("", "/tmp", null)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(fx.taskService.listProjects()).isEmpty();
    }

    @Test
    @DisplayName("Dependencies must point at another existing task")
    void dependencies() {
        Task a = fx.createTask(TestPipelines.simple());
        Task b = fx.createTask(TestPipelines.simple());

        fx.taskService.addDependency(a.id(), b.id());

        assertThat(fx.tasks.findDependencyIds(a.id())).containsExactly(b.id());
        assertThatThrownBy(() -> fx.taskService.addDependency(a.id(), a.id()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> fx.taskService.addDependency(a.id(), "ghost"))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Unknown ids are not found")
    void notFound() {
        assertThatThrownBy(() -> fx.taskService.getTask("missing")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> fx.taskService.getProject("missing")).isInstanceOf(NotFoundException.class);
    }
}
