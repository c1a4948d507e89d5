package dev.relaygate.queue;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/** Result channel of an enqueued job; the future completes once the job is terminal. */
public record JobHandle(UUID jobId, CompletableFuture<JobSnapshot> result) {
}
