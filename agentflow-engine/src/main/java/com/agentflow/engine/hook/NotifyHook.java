package com.agentflow.engine.hook;

import com.agentflow.core.model.HookResult;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.Transition;
import com.agentflow.core.model.TransitionContext;
import com.agentflow.core.model.TransitionHook;
import com.agentflow.core.spi.Notification;
import com.agentflow.core.spi.NotificationRouter;

import java.util.Map;

/**
 * Sends a notification rendered from the hook's templates.
 *
 * Placeholders: {taskTitle}, {taskId}, {fromStatus}, {toStatus}.
 */
public class NotifyHook implements HookFunction {

    static final String DEFAULT_TITLE = "Task update";
    static final String DEFAULT_BODY = "{taskTitle}: {fromStatus} → {toStatus}";

    private final NotificationRouter router;
    private final String defaultChannel;

    public NotifyHook(NotificationRouter router, String defaultChannel) {
        this.router = router;
        this.defaultChannel = defaultChannel;
    }

    @Override
    public HookResult execute(Task task, Transition transition, TransitionContext context, TransitionHook hook) {
        Map<String, String> values = Map.of(
            "taskTitle", task.title() != null ? task.title() : task.id(),
            "taskId", task.id(),
            "fromStatus", transition.from(),
            "toStatus", transition.to()
        );
        String title = render(orDefault(hook.param("titleTemplate"), DEFAULT_TITLE), values);
        String body = render(orDefault(hook.param("bodyTemplate"), DEFAULT_BODY), values);
        String channel = orDefault(hook.param("channel"), defaultChannel);

        router.send(new Notification(task.id(), title, body, channel));
        return HookResult.ok();
    }

    static String render(String template, Map<String, String> values) {
        String rendered = template;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            rendered = rendered.replace("{" + entry.getKey() + "}", entry.getValue());
        }
        return rendered;
    }

    private static String orDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }
}
