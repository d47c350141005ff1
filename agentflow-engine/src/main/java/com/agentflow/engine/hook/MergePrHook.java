package com.agentflow.engine.hook;

import com.agentflow.core.exception.HookExecutionException;
import com.agentflow.core.model.ArtifactType;
import com.agentflow.core.model.EventCategory;
import com.agentflow.core.model.HookResult;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskArtifact;
import com.agentflow.core.model.Transition;
import com.agentflow.core.model.TransitionContext;
import com.agentflow.core.model.TransitionHook;
import com.agentflow.core.repository.TaskArtifactRepository;
import com.agentflow.core.spi.ScmPlatform;
import com.agentflow.engine.logging.TaskEventRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges the task's most recent pull request.
 */
public class MergePrHook implements HookFunction {

    private static final Logger log = LoggerFactory.getLogger(MergePrHook.class);

    private final TaskArtifactRepository artifactRepository;
    private final ScmPlatform scm;
    private final TaskEventRecorder recorder;

    public MergePrHook(TaskArtifactRepository artifactRepository, ScmPlatform scm, TaskEventRecorder recorder) {
        this.artifactRepository = artifactRepository;
        this.scm = scm;
        this.recorder = recorder;
    }

    @Override
    public HookResult execute(Task task, Transition transition, TransitionContext context, TransitionHook hook) {
        TaskArtifact artifact = artifactRepository.findLatest(task.id(), ArtifactType.PR)
            .orElseThrow(() -> new HookExecutionException("No PR artifact found for task " + task.id()));
        if (artifact.data() == null || !artifact.data().hasNonNull("url")) {
            throw new HookExecutionException("PR artifact of task " + task.id() + " has no url");
        }
        String url = artifact.data().get("url").asText();

        try {
            scm.mergePullRequest(url);
        } catch (RuntimeException e) {
            recorder.error(task.id(), EventCategory.SCM, "PR merge failed: " + e.getMessage(),
                TaskEventRecorder.data("url", url));
            throw e;
        }

        log.info("Merged PR {} for task {}", url, task.id());
        recorder.info(task.id(), EventCategory.SCM, "PR merged", TaskEventRecorder.data("url", url));
        return HookResult.ok();
    }
}
