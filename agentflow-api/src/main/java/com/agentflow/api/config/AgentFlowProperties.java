package com.agentflow.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Settings bound from the {@code agentflow.*} namespace.
 */
@ConfigurationProperties(prefix = "agentflow")
public class AgentFlowProperties {

    private Supervisor supervisor = new Supervisor();
    private Agents agents = new Agents();
    private Workspace workspace = new Workspace();
    private Notifications notifications = new Notifications();
    private Pipelines pipelines = new Pipelines();

    public Supervisor getSupervisor() { return supervisor; }
    public void setSupervisor(Supervisor supervisor) { this.supervisor = supervisor; }
    public Agents getAgents() { return agents; }
    public void setAgents(Agents agents) { this.agents = agents; }
    public Workspace getWorkspace() { return workspace; }
    public void setWorkspace(Workspace workspace) { this.workspace = workspace; }
    public Notifications getNotifications() { return notifications; }
    public void setNotifications(Notifications notifications) { this.notifications = notifications; }
    public Pipelines getPipelines() { return pipelines; }
    public void setPipelines(Pipelines pipelines) { this.pipelines = pipelines; }

    public static class Supervisor {
        private Duration pollInterval = Duration.ofSeconds(30);
        private Duration defaultRunTimeout = Duration.ofMinutes(15);
        private Duration ghostGracePeriod = Duration.ofSeconds(60);
        private Map<String, Duration> runTimeouts = new HashMap<>();

        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
        public Duration getDefaultRunTimeout() { return defaultRunTimeout; }
        public void setDefaultRunTimeout(Duration defaultRunTimeout) { this.defaultRunTimeout = defaultRunTimeout; }
        public Duration getGhostGracePeriod() { return ghostGracePeriod; }
        public void setGhostGracePeriod(Duration ghostGracePeriod) { this.ghostGracePeriod = ghostGracePeriod; }
        public Map<String, Duration> getRunTimeouts() { return runTimeouts; }
        public void setRunTimeouts(Map<String, Duration> runTimeouts) { this.runTimeouts = runTimeouts; }
    }

    public static class Agents {
        private Duration outputFlushInterval = Duration.ofSeconds(3);
        private String defaultType = "scripted";
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public Duration getOutputFlushInterval() { return outputFlushInterval; }
        public void setOutputFlushInterval(Duration outputFlushInterval) { this.outputFlushInterval = outputFlushInterval; }
        public String getDefaultType() { return defaultType; }
        public void setDefaultType(String defaultType) { this.defaultType = defaultType; }
        public Duration getShutdownTimeout() { return shutdownTimeout; }
        public void setShutdownTimeout(Duration shutdownTimeout) { this.shutdownTimeout = shutdownTimeout; }
    }

    public static class Workspace {
        private String repository = ".";
        private String root = ".agentflow/worktrees";
        private String baseBranch = "main";
        private String branchPrefix = "task/";
        private Duration commandTimeout = Duration.ofMinutes(2);

        public String getRepository() { return repository; }
        public void setRepository(String repository) { this.repository = repository; }
        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
        public String getBaseBranch() { return baseBranch; }
        public void setBaseBranch(String baseBranch) { this.baseBranch = baseBranch; }
        public String getBranchPrefix() { return branchPrefix; }
        public void setBranchPrefix(String branchPrefix) { this.branchPrefix = branchPrefix; }
        public Duration getCommandTimeout() { return commandTimeout; }
        public void setCommandTimeout(Duration commandTimeout) { this.commandTimeout = commandTimeout; }
    }

    public static class Notifications {
        private String channel = "desktop";

        public String getChannel() { return channel; }
        public void setChannel(String channel) { this.channel = channel; }
    }

    public static class Pipelines {
        private String seedLocation = "classpath:pipelines/seeded-pipelines.json";

        public String getSeedLocation() { return seedLocation; }
        public void setSeedLocation(String seedLocation) { this.seedLocation = seedLocation; }
    }
}
