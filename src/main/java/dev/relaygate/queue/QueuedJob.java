package dev.relaygate.queue;

import dev.relaygate.domain.enums.JobPriority;
import dev.relaygate.domain.enums.JobState;
import dev.relaygate.domain.valueobject.AiRequest;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Mutable dispatcher-side state of one job. All state transitions are synchronized
 * on the job; the dispatcher owns the queue placement.
 */
final class QueuedJob {

    enum CancelOutcome { CANCELLED_WAITING, CANCEL_REQUESTED, NOT_CANCELLABLE }

    private final UUID id;
    private final String provider;
    private final String model;
    private final List<AiRequest> requests;
    private final JobPriority priority;
    private final int maxAttempts;
    private final Instant createdAt;
    private final String requestId;
    private final SubRequestResult[] results;
    private final CompletableFuture<JobSnapshot> future = new CompletableFuture<>();

    private JobState state = JobState.QUEUED;
    private long sequence;
    private int attempts;
    private Instant enqueuedAt;
    private Instant startedAt;
    private Instant finishedAt;
    private Instant nextAttemptAt;
    private volatile boolean cancelRequested;

    QueuedJob(UUID id, String provider, String model, List<AiRequest> requests, JobPriority priority,
              int maxAttempts, Instant now, long sequence, String requestId) {
        this.id = id;
        this.provider = provider;
        this.model = model;
        this.requests = List.copyOf(requests);
        this.priority = priority;
        this.maxAttempts = maxAttempts;
        this.createdAt = now;
        this.enqueuedAt = now;
        this.sequence = sequence;
        this.requestId = requestId;
        this.results = new SubRequestResult[requests.size()];
        for (int i = 0; i < results.length; i++) results[i] = SubRequestResult.pending(i);
    }

    synchronized boolean start(Instant now) {
        if (state != JobState.QUEUED) return false;
        state = JobState.RUNNING;
        attempts++;
        if (startedAt == null) startedAt = now;
        return true;
    }

    synchronized List<Integer> outstanding() {
        List<Integer> indexes = new ArrayList<>();
        for (SubRequestResult r : results) {
            if (r.isOutstanding()) indexes.add(r.index());
        }
        return indexes;
    }

    synchronized void record(SubRequestResult result) {
        results[result.index()] = result;
    }

    synchronized CancelOutcome cancel(Instant now) {
        switch (state) {
            case QUEUED, RETRY_WAIT -> {
                markRemainingCancelled();
                state = JobState.CANCELLED;
                finishedAt = now;
                nextAttemptAt = null;
                return CancelOutcome.CANCELLED_WAITING;
            }
            case RUNNING -> {
                cancelRequested = true;
                return CancelOutcome.CANCEL_REQUESTED;
            }
            default -> {
                return CancelOutcome.NOT_CANCELLABLE;
            }
        }
    }

    /**
     * Ends the current attempt. Transient failures go to {@code RETRY_WAIT} while attempts
     * remain; exhausted retries or a job without any success end {@code FAILED}. A cancel
     * requested mid-run only wins when work was left, either pending items or a retry.
     */
    synchronized JobState finishAttempt(Instant now, Duration retryDelay) {
        if (state != JobState.RUNNING)
            throw new IllegalStateException("Expected RUNNING but was " + state);
        boolean transientLeft = Arrays.stream(results)
                .anyMatch(r -> r.status() == SubRequestResult.Status.ERROR && Boolean.TRUE.equals(r.retryable()));
        boolean anySuccess = Arrays.stream(results).anyMatch(r -> r.status() == SubRequestResult.Status.SUCCESS);
        boolean pendingLeft = Arrays.stream(results).anyMatch(r -> r.status() == SubRequestResult.Status.PENDING);
        boolean retryLeft = transientLeft && attempts < maxAttempts;
        if (cancelRequested && (pendingLeft || retryLeft)) {
            markRemainingCancelled();
            state = JobState.CANCELLED;
        } else if (retryLeft) {
            state = JobState.RETRY_WAIT;
            nextAttemptAt = now.plus(retryDelay);
            return state;
        } else if (transientLeft || !anySuccess) {
            state = JobState.FAILED;
        } else {
            state = JobState.COMPLETED;
        }
        finishedAt = now;
        nextAttemptAt = null;
        return state;
    }

    synchronized boolean requeue(long newSequence, Instant now) {
        if (state != JobState.RETRY_WAIT) return false;
        state = JobState.QUEUED;
        sequence = newSequence;
        enqueuedAt = now;
        nextAttemptAt = null;
        return true;
    }

    synchronized JobSnapshot snapshot() {
        return new JobSnapshot(id, provider, model, priority, state, attempts, maxAttempts,
                List.of(results), createdAt, startedAt, finishedAt, nextAttemptAt);
    }

    void complete() {
        future.complete(snapshot());
    }

    private void markRemainingCancelled() {
        for (int i = 0; i < results.length; i++) {
            if (results[i].status() == SubRequestResult.Status.PENDING) results[i] = SubRequestResult.cancelled(i);
        }
    }

    // Getters
    UUID id() {
        return id;
    }

    String provider() {
        return provider;
    }

    String model() {
        return model;
    }

    List<AiRequest> requests() {
        return requests;
    }

    JobPriority priority() {
        return priority;
    }

    String requestId() {
        return requestId;
    }

    CompletableFuture<JobSnapshot> future() {
        return future;
    }

    boolean isCancelRequested() {
        return cancelRequested;
    }

    synchronized long sequence() {
        return sequence;
    }

    synchronized int attempts() {
        return attempts;
    }

    synchronized JobState state() {
        return state;
    }

    synchronized Instant enqueuedAt() {
        return enqueuedAt;
    }

    synchronized Instant finishedAt() {
        return finishedAt;
    }
}
