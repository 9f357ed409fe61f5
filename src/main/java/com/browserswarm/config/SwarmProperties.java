package com.browserswarm.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "swarm")
public class SwarmProperties {

    private AiProvider aiProvider = AiProvider.GOOGLE;
    private OpenAIConfig openai = new OpenAIConfig();
    private Pool pool = new Pool();
    private Coordinator coordinator = new Coordinator();
    private Worker worker = new Worker();
    private Automation automation = new Automation();

    public enum AiProvider {
        GOOGLE, OPENAI
    }

    public static class OpenAIConfig {
        private String model = "gpt-4o-mini";

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    public static class Pool {
        private int size = 5;
        private String hostTemplate = "worker-%d";
        private int agentPort = 8000;
        private int videoBasePort = 8766;
        private int mcpBasePort = 3011;
        private int vncBasePort = 6081;
        private Duration healthTimeout = Duration.ofSeconds(5);
        private Duration assignmentTimeout = Duration.ofSeconds(120);
        private Duration healthInterval = Duration.ofSeconds(30);
        private String publicHost = "localhost";
        private int agentExternalBasePort = 8001;

        public int getSize() {
            return size;
        }

        public void setSize(int size) {
            if (size <= 0) {
                return;
            }
            this.size = size;
        }

        public String getHostTemplate() {
            return hostTemplate;
        }

        public void setHostTemplate(String hostTemplate) {
            this.hostTemplate = hostTemplate;
        }

        public int getAgentPort() {
            return agentPort;
        }

        public void setAgentPort(int agentPort) {
            this.agentPort = agentPort;
        }

        public int getVideoBasePort() {
            return videoBasePort;
        }

        public void setVideoBasePort(int videoBasePort) {
            this.videoBasePort = videoBasePort;
        }

        public int getMcpBasePort() {
            return mcpBasePort;
        }

        public void setMcpBasePort(int mcpBasePort) {
            this.mcpBasePort = mcpBasePort;
        }

        public int getVncBasePort() {
            return vncBasePort;
        }

        public void setVncBasePort(int vncBasePort) {
            this.vncBasePort = vncBasePort;
        }

        public Duration getHealthTimeout() {
            return healthTimeout;
        }

        public void setHealthTimeout(Duration healthTimeout) {
            this.healthTimeout = healthTimeout;
        }

        public Duration getAssignmentTimeout() {
            return assignmentTimeout;
        }

        public void setAssignmentTimeout(Duration assignmentTimeout) {
            this.assignmentTimeout = assignmentTimeout;
        }

        public Duration getHealthInterval() {
            return healthInterval;
        }

        public void setHealthInterval(Duration healthInterval) {
            this.healthInterval = healthInterval;
        }

        public String getPublicHost() {
            return publicHost;
        }

        public void setPublicHost(String publicHost) {
            this.publicHost = publicHost;
        }

        public int getAgentExternalBasePort() {
            return agentExternalBasePort;
        }

        public void setAgentExternalBasePort(int agentExternalBasePort) {
            this.agentExternalBasePort = agentExternalBasePort;
        }
    }

    public static class Coordinator {
        private int maxAgents = 6;

        public int getMaxAgents() { return maxAgents; }
        public void setMaxAgents(int maxAgents) { this.maxAgents = maxAgents; }
    }

    public static class Worker {
        private boolean enabled;
        private int id = 1;
        private String coordinatorUrl = "http://orchestrator:8100";
        private int maxToolSteps = 5;
        private int maxClaimAttempts = 3;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getId() {
            return id;
        }

        public void setId(int id) {
            this.id = id;
        }

        public String getCoordinatorUrl() {
            return coordinatorUrl;
        }

        public void setCoordinatorUrl(String coordinatorUrl) {
            this.coordinatorUrl = coordinatorUrl;
        }

        public int getMaxToolSteps() {
            return maxToolSteps;
        }

        public void setMaxToolSteps(int maxToolSteps) {
            this.maxToolSteps = maxToolSteps;
        }

        public int getMaxClaimAttempts() {
            return maxClaimAttempts;
        }

        public void setMaxClaimAttempts(int maxClaimAttempts) {
            this.maxClaimAttempts = maxClaimAttempts;
        }
    }

    public static class Automation {
        private String serverUrl = "http://playwright-browser:3001";
        private String endpointPath = "/mcp";
        private Duration requestTimeout = Duration.ofSeconds(60);
        private String clientName = "browser-swarm-agent";
        private String clientVersion = "1.0.0";

        public String getServerUrl() {
            return serverUrl;
        }

        public void setServerUrl(String serverUrl) {
            this.serverUrl = serverUrl;
        }

        public String getEndpointPath() {
            return endpointPath;
        }

        public void setEndpointPath(String endpointPath) {
            this.endpointPath = endpointPath;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }

        public String getClientName() {
            return clientName;
        }

        public void setClientName(String clientName) {
            this.clientName = clientName;
        }

        public String getClientVersion() {
            return clientVersion;
        }

        public void setClientVersion(String clientVersion) {
            this.clientVersion = clientVersion;
        }

        public String endpointUrl() {
            String base = serverUrl.endsWith("/") ? serverUrl.substring(0, serverUrl.length() - 1) : serverUrl;
            String path = endpointPath.startsWith("/") ? endpointPath : "/" + endpointPath;
            return base + path;
        }
    }

    public AiProvider getAiProvider() {
        return aiProvider;
    }

    public void setAiProvider(AiProvider aiProvider) {
        this.aiProvider = aiProvider;
    }

    public OpenAIConfig getOpenai() {
        return openai;
    }

    public void setOpenai(OpenAIConfig openai) {
        this.openai = openai;
    }

    public Pool getPool() {
        return pool;
    }

    public void setPool(Pool pool) {
        this.pool = pool != null ? pool : new Pool();
    }

    public Coordinator getCoordinator() {
        return coordinator;
    }

    public void setCoordinator(Coordinator coordinator) {
        this.coordinator = coordinator != null ? coordinator : new Coordinator();
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker != null ? worker : new Worker();
    }

    public Automation getAutomation() {
        return automation;
    }

    public void setAutomation(Automation automation) {
        this.automation = automation != null ? automation : new Automation();
    }

    public int effectiveMaxAgents() {
        return Math.max(1, Math.min(coordinator.getMaxAgents(), pool.getSize()));
    }
}
