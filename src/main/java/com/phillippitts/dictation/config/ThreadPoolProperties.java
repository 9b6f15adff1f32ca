package com.phillippitts.dictation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides tuneable sizing for the provisioning executor (downloads, extraction) and the
 * server scheduler (process spawn, readiness polling, health checks).
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private ProvisionPoolProperties provision = new ProvisionPoolProperties();
    private ServerPoolProperties server = new ServerPoolProperties();

    public ProvisionPoolProperties getProvision() {
        return provision;
    }

    public void setProvision(ProvisionPoolProperties provision) {
        this.provision = provision;
    }

    public ServerPoolProperties getServer() {
        return server;
    }

    public void setServer(ServerPoolProperties server) {
        this.server = server;
    }

    /**
     * Provisioning executor configuration. Downloads are long-running, so the queue is small.
     */
    public static class ProvisionPoolProperties {
        private int corePoolSize = 1;
        private int maxPoolSize = 2;
        private int queueCapacity = 4;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "provision-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Server scheduler configuration.
     */
    public static class ServerPoolProperties {
        private int poolSize = 4;
        private String threadNamePrefix = "inference-server-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
