package com.healloop.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Sizes of the engine's shared history buffers.
 */
@Component
@ConfigurationProperties(prefix = "healloop.engine")
public class EngineProperties {

    private int telemetryCapacity = 500;
    private int failureHistoryCapacity = 200;
    private int memoryCapacity = 50;
    /** Snapshots handed to the contract builder as context. */
    private int memoryContextSize = 5;
    private int recommendationCapacity = 100;

    public int getTelemetryCapacity() {
        return telemetryCapacity;
    }

    public void setTelemetryCapacity(int telemetryCapacity) {
        this.telemetryCapacity = telemetryCapacity;
    }

    public int getFailureHistoryCapacity() {
        return failureHistoryCapacity;
    }

    public void setFailureHistoryCapacity(int failureHistoryCapacity) {
        this.failureHistoryCapacity = failureHistoryCapacity;
    }

    public int getMemoryCapacity() {
        return memoryCapacity;
    }

    public void setMemoryCapacity(int memoryCapacity) {
        this.memoryCapacity = memoryCapacity;
    }

    public int getMemoryContextSize() {
        return memoryContextSize;
    }

    public void setMemoryContextSize(int memoryContextSize) {
        this.memoryContextSize = memoryContextSize;
    }

    public int getRecommendationCapacity() {
        return recommendationCapacity;
    }

    public void setRecommendationCapacity(int recommendationCapacity) {
        this.recommendationCapacity = recommendationCapacity;
    }
}
