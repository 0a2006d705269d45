package com.foresight.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "foresight.pipeline")
public class PipelineProperties {

    /** Upper bound on concurrent work items within a single fan-out. */
    private int maxParallel = 8;

    /** Threads for background analysis runs and accepted recommendations. */
    private int backgroundThreads = 8;

    /** How long shutdown waits for background work to finish. */
    private int shutdownAwaitSeconds = 120;

    public int getMaxParallel() {
        return maxParallel;
    }

    public void setMaxParallel(int maxParallel) {
        this.maxParallel = maxParallel;
    }

    public int getBackgroundThreads() {
        return backgroundThreads;
    }

    public void setBackgroundThreads(int backgroundThreads) {
        this.backgroundThreads = backgroundThreads;
    }

    public int getShutdownAwaitSeconds() {
        return shutdownAwaitSeconds;
    }

    public void setShutdownAwaitSeconds(int shutdownAwaitSeconds) {
        this.shutdownAwaitSeconds = shutdownAwaitSeconds;
    }
}
