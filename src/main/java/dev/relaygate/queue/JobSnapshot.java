package dev.relaygate.queue;

import dev.relaygate.domain.enums.JobPriority;
import dev.relaygate.domain.enums.JobState;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Immutable view of a job, handed to callers and completed into the job's future. */
public record JobSnapshot(UUID id, String provider, String model, JobPriority priority, JobState state,
                          int attempts, int maxAttempts, List<SubRequestResult> results,
                          Instant createdAt, Instant startedAt, Instant finishedAt, Instant nextAttemptAt) {

    public long successful() {
        return results.stream().filter(r -> r.status() == SubRequestResult.Status.SUCCESS).count();
    }

    public long failed() {
        return results.stream().filter(r -> r.status() == SubRequestResult.Status.ERROR).count();
    }
}
