package com.phillippitts.talkback.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>Every session keeps a few long-running workers busy (audio frames, transcripts, tokens,
 * playback) plus short prefetch tasks, so the pool hands tasks straight to threads instead of
 * queueing them behind a running stream.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private ConversationPoolProperties conversation = new ConversationPoolProperties();

    public ConversationPoolProperties getConversation() {
        return conversation;
    }

    public void setConversation(ConversationPoolProperties conversation) {
        this.conversation = conversation;
    }

    /**
     * Conversation worker pool configuration.
     */
    public static class ConversationPoolProperties {
        private int corePoolSize = 8;
        private int maxPoolSize = 64;
        private int queueCapacity = 0;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "conversation-worker-";

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
}
