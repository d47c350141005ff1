package com.agentflow.engine.agent;

import com.agentflow.core.model.AgentRun;
import com.agentflow.core.model.ArtifactType;
import com.agentflow.core.model.EventCategory;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskArtifact;
import com.agentflow.core.repository.TaskArtifactRepository;
import com.agentflow.core.repository.TaskRepository;
import com.agentflow.core.spi.GitOperations;
import com.agentflow.core.spi.PullRequest;
import com.agentflow.core.spi.PullRequestRequest;
import com.agentflow.core.spi.ScmPlatform;
import com.agentflow.core.spi.Workspace;
import com.agentflow.engine.logging.TaskEventRecorder;
import com.agentflow.engine.outcome.OutcomeSchemaRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;

/**
 * Records what a successful run produced. Nothing here fails the run:
 * every step is best effort and problems become task events.
 */
public class ArtifactCollector {

    private static final Logger log = LoggerFactory.getLogger(ArtifactCollector.class);

    private final TaskArtifactRepository artifactRepository;
    private final TaskRepository taskRepository;
    private final GitOperations git;
    private final ScmPlatform scm;
    private final TaskEventRecorder recorder;
    private final ObjectMapper objectMapper;
    private final AgentRuntimeSettings settings;
    private final Clock clock;

    public ArtifactCollector(
            TaskArtifactRepository artifactRepository,
            TaskRepository taskRepository,
            GitOperations git,
            ScmPlatform scm,
            TaskEventRecorder recorder,
            ObjectMapper objectMapper,
            AgentRuntimeSettings settings,
            Clock clock) {
        this.artifactRepository = artifactRepository;
        this.taskRepository = taskRepository;
        this.git = git;
        this.scm = scm;
        this.recorder = recorder;
        this.objectMapper = objectMapper;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Always records the branch. For {@code pr_ready} also records the diff,
     * pushes the branch and opens a pull request.
     */
    public CollectedArtifacts collect(Task task, AgentRun run, Workspace workspace, String outcome) {
        append(task.id(), ArtifactType.BRANCH, TaskEventRecorder.data(
            "branch", workspace.branch(),
            "agentRunId", run.id()));

        if (!OutcomeSchemaRegistry.PR_READY.equals(outcome)) {
            return CollectedArtifacts.NONE;
        }

        String diff = null;
        try {
            diff = git.diff(workspace.path(), settings.baseBranch());
        } catch (RuntimeException e) {
            log.warn("Diff of {} against {} failed: {}", workspace.branch(), settings.baseBranch(), e.getMessage());
            recorder.warning(task.id(), EventCategory.GIT, "Failed to verify branch diff: " + e.getMessage(),
                TaskEventRecorder.data("branch", workspace.branch()));
        }
        if (diff != null) {
            append(task.id(), ArtifactType.DIFF, TaskEventRecorder.data(
                "branch", workspace.branch(),
                "base", settings.baseBranch(),
                "diff", diff));
            if (diff.isBlank()) {
                recorder.warning(task.id(), EventCategory.AGENT,
                    "Agent reported pr_ready but no changes detected on branch, skipping transition",
                    TaskEventRecorder.data("branch", workspace.branch()));
                return new CollectedArtifacts(true, null);
            }
        }

        try {
            git.push(workspace.path(), workspace.branch());
            PullRequest pr = scm.createPullRequest(new PullRequestRequest(
                workspace.path(),
                task.title(),
                "Automated PR for task " + task.id(),
                workspace.branch(),
                settings.baseBranch()));
            append(task.id(), ArtifactType.PR, TaskEventRecorder.data(
                "url", pr.url(),
                "number", pr.number(),
                "branch", workspace.branch()));
            taskRepository.updatePullRequest(task.id(), pr.url(), workspace.branch(), clock.instant());
            recorder.info(task.id(), EventCategory.SCM, "PR created: " + pr.url(),
                TaskEventRecorder.data("url", pr.url(), "number", pr.number()));
            log.info("Opened PR {} for task {}", pr.url(), task.id());
            return new CollectedArtifacts(false, pr);
        } catch (RuntimeException e) {
            log.error("Push/PR for task {} failed: {}", task.id(), e.getMessage());
            recorder.error(task.id(), EventCategory.SCM, "Push/PR creation failed: " + e.getMessage(),
                TaskEventRecorder.data("branch", workspace.branch()));
            return CollectedArtifacts.NONE;
        }
    }

    private void append(String taskId, ArtifactType type, Map<String, Object> data) {
        try {
            artifactRepository.append(TaskArtifact.of(taskId, type, objectMapper.valueToTree(data), clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Failed to record {} artifact for task {}: {}", type.value(), taskId, e.getMessage());
        }
    }

    /**
     * @param emptyDiff   pr_ready was reported but the branch has no changes
     * @param pullRequest the pull request opened, or null
     */
    public record CollectedArtifacts(boolean emptyDiff, PullRequest pullRequest) {

        public static final CollectedArtifacts NONE = new CollectedArtifacts(false, null);
    }
}
