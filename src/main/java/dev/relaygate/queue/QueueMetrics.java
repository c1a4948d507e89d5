package dev.relaygate.queue;

import java.util.Map;

public record QueueMetrics(long totalQueued, long totalProcessed, long totalFailed, long totalCancelled,
                           double averageWaitMillis, int waiting, Map<String, Integer> queueSizeByPriority,
                           Map<String, Integer> activeByProvider, boolean paused) {
}
