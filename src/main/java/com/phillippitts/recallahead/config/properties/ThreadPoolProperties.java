package com.phillippitts.recallahead.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>The recall loop is always a single thread; only its naming and shutdown grace are tuneable.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private LoopProperties loop = new LoopProperties();

    public LoopProperties getLoop() {
        return loop;
    }

    public void setLoop(LoopProperties loop) {
        this.loop = loop;
    }

    /**
     * Recall event loop configuration.
     */
    public static class LoopProperties {
        private String threadNamePrefix = "recall-loop-";
        private int awaitTerminationSeconds = 5;

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getAwaitTerminationSeconds() {
            return awaitTerminationSeconds;
        }

        public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
            this.awaitTerminationSeconds = awaitTerminationSeconds;
        }
    }
}
