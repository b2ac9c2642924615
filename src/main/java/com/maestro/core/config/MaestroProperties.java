package com.maestro.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "maestro")
public class MaestroProperties {

    private String projectRoot = ".";
    private String projectName = "";
    private String pipelineVersion = "classic";
    private Debate debate = new Debate();
    private Models models = new Models();
    private Checkpoint checkpoint = new Checkpoint();
    private Agent agent = new Agent();
    private Build build = new Build();

    public String getProjectRoot() { return projectRoot; }
    public void setProjectRoot(String projectRoot) { this.projectRoot = projectRoot; }
    public String getProjectName() { return projectName; }
    public void setProjectName(String projectName) { this.projectName = projectName; }
    public String getPipelineVersion() { return pipelineVersion; }
    public void setPipelineVersion(String pipelineVersion) { this.pipelineVersion = pipelineVersion; }
    public Debate getDebate() { return debate; }
    public void setDebate(Debate debate) { this.debate = debate; }
    public Models getModels() { return models; }
    public void setModels(Models models) { this.models = models; }
    public Checkpoint getCheckpoint() { return checkpoint; }
    public void setCheckpoint(Checkpoint checkpoint) { this.checkpoint = checkpoint; }
    public Agent getAgent() { return agent; }
    public void setAgent(Agent agent) { this.agent = agent; }
    public Build getBuild() { return build; }
    public void setBuild(Build build) { this.build = build; }

    /** Absolute, normalized project root. */
    public Path projectRootPath() {
        return Path.of(projectRoot).toAbsolutePath().normalize();
    }

    /**
     * Project name, defaulting to the project root's directory name when unset.
     */
    public String resolvedProjectName() {
        if (projectName != null && !projectName.isBlank()) {
            return projectName;
        }
        Path fileName = projectRootPath().getFileName();
        return fileName != null ? fileName.toString() : "project";
    }

    public static class Debate {
        private double contentionThreshold = 0.5;
        private int maxParallelAgents = 4;
        private int maxArtifactChars = 60_000;
        private String synthesizerRole = "Synthesizer";
        private Map<String, String> stageIntensity = new LinkedHashMap<>();

        public double getContentionThreshold() { return contentionThreshold; }
        public void setContentionThreshold(double contentionThreshold) { this.contentionThreshold = contentionThreshold; }
        public int getMaxParallelAgents() { return maxParallelAgents; }
        public void setMaxParallelAgents(int maxParallelAgents) { this.maxParallelAgents = maxParallelAgents; }
        public int getMaxArtifactChars() { return maxArtifactChars; }
        public void setMaxArtifactChars(int maxArtifactChars) { this.maxArtifactChars = maxArtifactChars; }
        public String getSynthesizerRole() { return synthesizerRole; }
        public void setSynthesizerRole(String synthesizerRole) { this.synthesizerRole = synthesizerRole; }
        public Map<String, String> getStageIntensity() { return stageIntensity; }
        public void setStageIntensity(Map<String, String> stageIntensity) { this.stageIntensity = stageIntensity; }
    }

    public static class Models {
        private String manifestUrl = "";
        private int fetchTimeoutMs = 3000;

        public String getManifestUrl() { return manifestUrl; }
        public void setManifestUrl(String manifestUrl) { this.manifestUrl = manifestUrl; }
        public int getFetchTimeoutMs() { return fetchTimeoutMs; }
        public void setFetchTimeoutMs(int fetchTimeoutMs) { this.fetchTimeoutMs = fetchTimeoutMs; }

        public boolean hasManifestUrl() {
            return manifestUrl != null && !manifestUrl.isBlank();
        }
    }

    public static class Checkpoint {
        private int maxRetention = 10;
        private boolean preserveMilestones = true;
        private boolean includeConfig = false;
        private boolean autoCheckpointOnComplete = true;

        public int getMaxRetention() { return maxRetention; }
        public void setMaxRetention(int maxRetention) { this.maxRetention = maxRetention; }
        public boolean isPreserveMilestones() { return preserveMilestones; }
        public void setPreserveMilestones(boolean preserveMilestones) { this.preserveMilestones = preserveMilestones; }
        public boolean isIncludeConfig() { return includeConfig; }
        public void setIncludeConfig(boolean includeConfig) { this.includeConfig = includeConfig; }
        public boolean isAutoCheckpointOnComplete() { return autoCheckpointOnComplete; }
        public void setAutoCheckpointOnComplete(boolean autoCheckpointOnComplete) { this.autoCheckpointOnComplete = autoCheckpointOnComplete; }
    }

    public static class Agent {
        private String command = "claude -p";
        private int timeoutSeconds = 900;

        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class Build {
        private int timeoutSeconds = 600;
        private int minSourceFiles = 3;

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public int getMinSourceFiles() { return minSourceFiles; }
        public void setMinSourceFiles(int minSourceFiles) { this.minSourceFiles = minSourceFiles; }
    }
}
