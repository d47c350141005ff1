package com.agentflow.api.config;

import com.agentflow.core.spi.Notification;
import com.agentflow.core.spi.NotificationRouter;
import com.agentflow.engine.service.AgentService;
import com.agentflow.recovery.AgentSupervisor;
import com.agentflow.recovery.InterruptedRun;
import com.agentflow.recovery.StartupRecovery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Startup and shutdown ordering.
 *
 * Once all singletons exist, and before the web server starts:
 * 1. Seed pipelines
 * 2. Reconcile runs left running by the previous process
 * 3. Notify about each interrupted run
 *
 * When the application is ready the supervisor starts.
 *
 * On shutdown the supervisor stops first, then the agent service drains.
 */
@Component
public class AgentFlowLifecycle implements SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(AgentFlowLifecycle.class);

    private final PipelineSeeder pipelineSeeder;
    private final StartupRecovery startupRecovery;
    private final AgentSupervisor supervisor;
    private final AgentService agentService;
    private final NotificationRouter notifications;
    private final AgentFlowProperties properties;

    public AgentFlowLifecycle(
            PipelineSeeder pipelineSeeder,
            StartupRecovery startupRecovery,
            AgentSupervisor supervisor,
            AgentService agentService,
            NotificationRouter notifications,
            AgentFlowProperties properties) {
        this.pipelineSeeder = pipelineSeeder;
        this.startupRecovery = startupRecovery;
        this.supervisor = supervisor;
        this.agentService = agentService;
        this.notifications = notifications;
        this.properties = properties;
    }

    @Override
    public void afterSingletonsInstantiated() {
        pipelineSeeder.seed();

        List<InterruptedRun> interrupted = startupRecovery.recover();
        for (InterruptedRun run : interrupted) {
            notifyInterrupted(run);
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        supervisor.start();
        log.info("agentflow ready");
    }

    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown() {
        log.info("Initiating graceful shutdown");
        supervisor.stop();
        agentService.shutdown(properties.getAgents().getShutdownTimeout());
        log.info("Graceful shutdown complete");
    }

    private void notifyInterrupted(InterruptedRun run) {
        try {
            notifications.send(new Notification(
                run.taskId(),
                "Agent run interrupted",
                String.format("The %s run (%s) of task %s was interrupted by a restart", run.mode(), run.agentType(), run.taskId()),
                properties.getNotifications().getChannel()));
        } catch (RuntimeException e) {
            log.warn("Failed to notify about interrupted run {}: {}", run.runId(), e.getMessage());
        }
    }
}
