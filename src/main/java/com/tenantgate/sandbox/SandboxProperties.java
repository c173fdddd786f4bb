package com.tenantgate.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "tenantgate")
public class SandboxProperties {

    private Sandbox sandbox = new Sandbox();
    private Agent agent = new Agent();

    // -- Sandbox accessors (delegate to nested) --
    public String getProvider() { return sandbox.provider; }
    public String getImage() { return sandbox.image; }
    public String getNetwork() { return sandbox.network; }
    public int getMemoryLimitMb() { return sandbox.memoryLimitMb; }
    public int getCpuCount() { return sandbox.cpuCount; }
    public int getExecTimeoutSeconds() { return sandbox.execTimeoutSeconds; }
    public String getDockerHost() { return sandbox.dockerHost; }

    // -- Agent accessors (delegate to nested) --
    public int getAgentPort() { return agent.port; }
    public String getAgentHealthPath() { return agent.healthPath; }
    public String getAgentCommand() { return agent.command; }
    public String getAgentWorkDir() { return agent.workDir; }
    public String getAgentLogFile() { return agent.logFile; }
    public String getSkillsPath() { return agent.skillsPath; }
    public String getConfigPath() { return agent.configPath; }
    public int getHealthPollAttempts() { return agent.healthPollAttempts; }
    public Duration getHealthPollInterval() { return agent.healthPollInterval; }
    public Duration getRequestTimeout() { return agent.requestTimeout; }
    public List<Duration> getWebsocketRetryDelays() { return agent.websocketRetryDelays; }

    /**
     * Returns true when AWS Bedrock credentials are configured and should take
     * precedence over a direct Anthropic API key.
     */
    public boolean isBedrockConfigured() {
        return agent.awsAccessKeyId != null && !agent.awsAccessKeyId.isBlank()
                && agent.awsSecretAccessKey != null && !agent.awsSecretAccessKey.isBlank();
    }

    public Sandbox getSandbox() { return sandbox; }
    public void setSandbox(Sandbox sandbox) { this.sandbox = sandbox; }
    public Agent getAgent() { return agent; }
    public void setAgent(Agent agent) { this.agent = agent; }

    public static class Sandbox {
        private String provider = "docker";
        private String image = "tenantgate/agent-sandbox:latest";
        private String network;
        private int memoryLimitMb = 2048;
        private int cpuCount = 1;
        private int execTimeoutSeconds = 30;
        private String dockerHost;

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
        public String getNetwork() { return network; }
        public void setNetwork(String network) { this.network = network; }
        public int getMemoryLimitMb() { return memoryLimitMb; }
        public void setMemoryLimitMb(int memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }
        public int getCpuCount() { return cpuCount; }
        public void setCpuCount(int cpuCount) { this.cpuCount = cpuCount; }
        public int getExecTimeoutSeconds() { return execTimeoutSeconds; }
        public void setExecTimeoutSeconds(int execTimeoutSeconds) { this.execTimeoutSeconds = execTimeoutSeconds; }
        public String getDockerHost() { return dockerHost; }
        public void setDockerHost(String dockerHost) { this.dockerHost = dockerHost; }
    }

    public static class Agent {
        private int port = 8080;
        private String healthPath = "/health";
        private String command = "node /app/packages/agent/dist/index.js";
        private String workDir = "/app/packages/agent";
        private String logFile = "/tmp/agent.log";
        private String skillsPath = "/app/skills";
        private String configPath = "/app/config";
        private int healthPollAttempts = 30;
        private Duration healthPollInterval = Duration.ofMillis(200);
        private Duration requestTimeout = Duration.ofMinutes(5);
        private List<Duration> websocketRetryDelays =
                List.of(Duration.ofSeconds(1), Duration.ofSeconds(3), Duration.ofSeconds(8));
        private String anthropicApiKey;
        private String awsAccessKeyId;
        private String awsSecretAccessKey;
        private String awsRegion = "us-east-1";
        private Map<String, String> extraEnv = new LinkedHashMap<>();

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }
        public String getHealthPath() { return healthPath; }
        public void setHealthPath(String healthPath) { this.healthPath = healthPath; }
        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public String getWorkDir() { return workDir; }
        public void setWorkDir(String workDir) { this.workDir = workDir; }
        public String getLogFile() { return logFile; }
        public void setLogFile(String logFile) { this.logFile = logFile; }
        public String getSkillsPath() { return skillsPath; }
        public void setSkillsPath(String skillsPath) { this.skillsPath = skillsPath; }
        public String getConfigPath() { return configPath; }
        public void setConfigPath(String configPath) { this.configPath = configPath; }
        public int getHealthPollAttempts() { return healthPollAttempts; }
        public void setHealthPollAttempts(int healthPollAttempts) { this.healthPollAttempts = healthPollAttempts; }
        public Duration getHealthPollInterval() { return healthPollInterval; }
        public void setHealthPollInterval(Duration healthPollInterval) { this.healthPollInterval = healthPollInterval; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
        public List<Duration> getWebsocketRetryDelays() { return websocketRetryDelays; }
        public void setWebsocketRetryDelays(List<Duration> websocketRetryDelays) { this.websocketRetryDelays = websocketRetryDelays; }
        public String getAnthropicApiKey() { return anthropicApiKey; }
        public void setAnthropicApiKey(String anthropicApiKey) { this.anthropicApiKey = anthropicApiKey; }
        public String getAwsAccessKeyId() { return awsAccessKeyId; }
        public void setAwsAccessKeyId(String awsAccessKeyId) { this.awsAccessKeyId = awsAccessKeyId; }
        public String getAwsSecretAccessKey() { return awsSecretAccessKey; }
        public void setAwsSecretAccessKey(String awsSecretAccessKey) { this.awsSecretAccessKey = awsSecretAccessKey; }
        public String getAwsRegion() { return awsRegion; }
        public void setAwsRegion(String awsRegion) { this.awsRegion = awsRegion; }
        public Map<String, String> getExtraEnv() { return extraEnv; }
        public void setExtraEnv(Map<String, String> extraEnv) { this.extraEnv = extraEnv; }
    }
}
