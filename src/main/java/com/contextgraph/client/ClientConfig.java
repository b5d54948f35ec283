package com.contextgraph.client;

import com.contextgraph.tools.ToolClassifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * SDK-side settings: where records go and how tools are classified.
 */
public class ClientConfig {

    public static final String DEFAULT_SERVER_URL = "http://localhost:8080";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_FAILED_QUEUE = 1000;

    public static final String ENV_SERVER_URL = "CONTEXTGRAPH_SERVER_URL";
    public static final String ENV_API_KEY = "CONTEXTGRAPH_API_KEY";

    private final String serverUrl;
    private final String apiKey;
    private final List<String> writeTools;
    private final List<String> readTools;
    private final Duration timeout;
    private final boolean raiseOnError;
    private final int maxFailedQueue;
    private final boolean localMode;

    private ClientConfig(Builder builder) {
        this.serverUrl = builder.serverUrl;
        this.apiKey = builder.apiKey;
        this.writeTools = List.copyOf(builder.writeTools);
        this.readTools = List.copyOf(builder.readTools);
        this.timeout = builder.timeout;
        this.raiseOnError = builder.raiseOnError;
        this.maxFailedQueue = builder.maxFailedQueue;
        this.localMode = builder.localMode;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ClientConfig defaults() {
        return builder().build();
    }

    public String getServerUrl() {
        return serverUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public List<String> getWriteTools() {
        return writeTools;
    }

    public List<String> getReadTools() {
        return readTools;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public boolean isRaiseOnError() {
        return raiseOnError;
    }

    public int getMaxFailedQueue() {
        return maxFailedQueue;
    }

    public boolean isLocalMode() {
        return localMode;
    }

    public ToolClassifier toolClassifier() {
        return new ToolClassifier(writeTools, readTools);
    }

    public static class Builder {
        private String serverUrl = DEFAULT_SERVER_URL;
        private String apiKey;
        private final List<String> writeTools = new ArrayList<>();
        private final List<String> readTools = new ArrayList<>();
        private Duration timeout = DEFAULT_TIMEOUT;
        private boolean raiseOnError;
        private int maxFailedQueue = DEFAULT_MAX_FAILED_QUEUE;
        private boolean localMode;

        public Builder serverUrl(String serverUrl) {
            if (serverUrl != null && !serverUrl.isBlank()) {
                this.serverUrl = serverUrl.trim();
            }
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder writeTools(Collection<String> tools) {
            if (tools != null) {
                writeTools.addAll(tools);
            }
            return this;
        }

        public Builder readTools(Collection<String> tools) {
            if (tools != null) {
                readTools.addAll(tools);
            }
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        public Builder raiseOnError(boolean raiseOnError) {
            this.raiseOnError = raiseOnError;
            return this;
        }

        public Builder maxFailedQueue(int maxFailedQueue) {
            if (maxFailedQueue < 1) {
                throw new IllegalArgumentException("maxFailedQueue must be at least 1");
            }
            this.maxFailedQueue = maxFailedQueue;
            return this;
        }

        public Builder localMode(boolean localMode) {
            this.localMode = localMode;
            return this;
        }

        /**
         * Pick up server URL and API key from the environment when set.
         */
        public Builder fromEnvironment(Map<String, String> env) {
            if (env == null) {
                return this;
            }
            serverUrl(env.get(ENV_SERVER_URL));
            String key = env.get(ENV_API_KEY);
            if (key != null && !key.isBlank()) {
                this.apiKey = key.trim();
            }
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(this);
        }
    }
}
