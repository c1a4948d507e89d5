package dev.relaygate.queue;

import dev.relaygate.config.GatewayProperties;
import dev.relaygate.config.RequestIdFilter;
import dev.relaygate.domain.enums.JobPriority;
import dev.relaygate.domain.enums.JobState;
import dev.relaygate.domain.valueobject.AiRequest;
import dev.relaygate.exception.NotFoundException;
import dev.relaygate.exception.ProviderException;
import dev.relaygate.exception.QueueFullException;
import dev.relaygate.exception.ValidationException;
import dev.relaygate.infrastructure.ai.ProviderClient;
import dev.relaygate.infrastructure.ai.ProviderClientRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Asynchronous dispatcher for queued provider work.
 *
 * <p>Design decisions:
 * <ul>
 *   <li>One lane per provider: a priority queue ordered by (priority, arrival) drained by a
 *       fixed pool whose size is the provider's configured concurrency.</li>
 *   <li>Sub-requests of a job run sequentially on one worker; each gets its own result so a
 *       job can partially succeed.</li>
 *   <li>Only transient failures are retried, and only the sub-requests that failed. A retry
 *       waits off-lane on a scheduler and re-enters at the back of its tier.</li>
 *   <li>The size limit counts waiting jobs (queued or retry-waiting), not running ones.</li>
 * </ul>
 */
@Component
public class RequestDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);

    static final double WAIT_ALPHA = 0.1;
    private static final Duration RETENTION = Duration.ofHours(1);
    private static final long POLL_MILLIS = 200;
    private static final Comparator<QueuedJob> ORDER =
            Comparator.comparingInt((QueuedJob j) -> j.priority().level()).thenComparingLong(QueuedJob::sequence);

    private final ProviderClientRegistry clients;
    private final GatewayProperties.Queue config;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final Map<String, Lane> lanes = new LinkedHashMap<>();
    private final Map<UUID, QueuedJob> jobs = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicInteger waiting = new AtomicInteger();
    private final AtomicLong totalQueued = new AtomicLong();
    private final AtomicLong totalProcessed = new AtomicLong();
    private final AtomicLong totalFailed = new AtomicLong();
    private final AtomicLong totalCancelled = new AtomicLong();
    private final Object pauseLock = new Object();
    private final Object waitLock = new Object();

    private ScheduledExecutorService retryScheduler;
    private double averageWaitMillis;
    private boolean waitSampled;
    private volatile boolean paused;
    private volatile boolean running;

    public RequestDispatcher(ProviderClientRegistry clients, GatewayProperties properties,
                             MeterRegistry meterRegistry, Clock clock) {
        this.clients = clients;
        this.config = properties.queue();
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        for (String provider : clients.providers()) {
            lanes.put(provider, new Lane(provider, config.concurrencyFor(provider)));
        }
    }

    @PostConstruct
    public synchronized void start() {
        if (running) return;
        running = true;
        retryScheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("dispatch-retry-"));
        Gauge.builder("relaygate.queue.waiting", waiting, AtomicInteger::get)
                .description("Jobs queued or waiting for a retry")
                .register(meterRegistry);
        Gauge.builder("relaygate.queue.wait.average", this, d -> d.averageWaitMillis())
                .baseUnit("milliseconds")
                .register(meterRegistry);
        lanes.values().forEach(Lane::start);
        log.info("Dispatcher started with lanes {}", lanes.keySet());
    }

    // ── Operations ─────────────────────────────────────────────────

    public JobHandle enqueue(String provider, String model, List<AiRequest> requests, JobPriority priority) {
        if (!running) throw new IllegalStateException("Dispatcher is not running");
        Lane lane = provider != null ? lanes.get(provider) : null;
        if (lane == null) {
            throw new ValidationException("Unknown provider: " + provider)
                    .hint("validProviders", List.copyOf(lanes.keySet()));
        }
        if (requests == null || requests.isEmpty())
            throw new ValidationException("At least one request is required");
        reserveSlot();

        QueuedJob job = new QueuedJob(UUID.randomUUID(), provider, model, requests,
                priority != null ? priority : JobPriority.NORMAL, config.maxAttempts(), clock.instant(),
                sequence.incrementAndGet(), MDC.get(RequestIdFilter.MDC_KEY));
        jobs.put(job.id(), job);
        totalQueued.incrementAndGet();
        lane.queue.offer(job);
        log.debug("Queued job {} for {} with {} request(s) at {} priority",
                job.id(), provider, requests.size(), job.priority().wireName());
        return new JobHandle(job.id(), job.future());
    }

    public Optional<JobSnapshot> getStatus(UUID jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(QueuedJob::snapshot);
    }

    /**
     * Cancels a job. Returns {@code false} when the job already finished.
     * A running job stops after its current sub-request.
     */
    public boolean cancel(UUID jobId) {
        QueuedJob job = jobs.get(jobId);
        if (job == null) throw new NotFoundException("Job", jobId);
        return switch (job.cancel(clock.instant())) {
            case CANCELLED_WAITING -> {
                Lane lane = lanes.get(job.provider());
                if (lane != null) lane.queue.remove(job);
                waiting.decrementAndGet();
                totalCancelled.incrementAndGet();
                job.complete();
                log.info("Cancelled waiting job {}", jobId);
                yield true;
            }
            case CANCEL_REQUESTED -> {
                log.info("Cancellation requested for running job {}", jobId);
                yield true;
            }
            case NOT_CANCELLABLE -> false;
        };
    }

    public void pause() {
        synchronized (pauseLock) {
            paused = true;
        }
        log.info("Dispatcher paused");
    }

    public void resume() {
        synchronized (pauseLock) {
            paused = false;
            pauseLock.notifyAll();
        }
        log.info("Dispatcher resumed");
    }

    public boolean isPaused() {
        return paused;
    }

    /** Cancels every job that has not started running. */
    public int clear() {
        int cleared = 0;
        for (QueuedJob job : jobs.values()) {
            JobState state = job.state();
            if ((state == JobState.QUEUED || state == JobState.RETRY_WAIT) && cancel(job.id())) cleared++;
        }
        log.info("Cleared {} waiting job(s)", cleared);
        return cleared;
    }

    public QueueMetrics metrics() {
        Map<String, Integer> byPriority = new TreeMap<>();
        for (JobPriority p : JobPriority.values()) byPriority.put(p.wireName(), 0);
        Map<String, Integer> activeByProvider = new TreeMap<>();
        for (Lane lane : lanes.values()) {
            for (QueuedJob job : lane.queue) byPriority.merge(job.priority().wireName(), 1, Integer::sum);
            activeByProvider.put(lane.provider, lane.active.get());
        }
        return new QueueMetrics(totalQueued.get(), totalProcessed.get(), totalFailed.get(), totalCancelled.get(),
                averageWaitMillis(), waiting.get(), byPriority, activeByProvider, paused);
    }

    public List<String> providers() {
        return List.copyOf(lanes.keySet());
    }

    @Scheduled(fixedDelayString = "${relaygate.queue.purge-interval:PT1M}")
    public void purgeFinished() {
        Instant cutoff = clock.instant().minus(RETENTION);
        int before = jobs.size();
        jobs.values().removeIf(job -> job.state().isTerminal()
                && job.finishedAt() != null && job.finishedAt().isBefore(cutoff));
        int purged = before - jobs.size();
        if (purged > 0) log.debug("Purged {} finished job(s)", purged);
    }

    @PreDestroy
    public void shutdown() {
        synchronized (this) {
            if (!running) return;
            running = false;
        }
        synchronized (pauseLock) {
            pauseLock.notifyAll();
        }
        retryScheduler.shutdownNow();
        lanes.values().forEach(lane -> lane.workers.shutdown());
        long deadline = System.nanoTime() + config.timeout().toNanos();
        for (Lane lane : lanes.values()) {
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                if (!lane.workers.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                    log.warn("Lane {} did not drain in time; interrupting workers", lane.provider);
                    lane.workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lane.workers.shutdownNow();
            }
        }
        int abandoned = 0;
        for (QueuedJob job : jobs.values()) {
            if (job.cancel(clock.instant()) == QueuedJob.CancelOutcome.CANCELLED_WAITING) {
                waiting.decrementAndGet();
                totalCancelled.incrementAndGet();
                job.complete();
                abandoned++;
            }
        }
        log.info("Dispatcher stopped; {} waiting job(s) cancelled", abandoned);
    }

    // ── Internal ───────────────────────────────────────────────────

    private void reserveSlot() {
        while (true) {
            int current = waiting.get();
            if (current >= config.maxSize()) throw new QueueFullException(config.maxSize());
            if (waiting.compareAndSet(current, current + 1)) return;
        }
    }

    private void work(Lane lane) {
        while (running) {
            try {
                awaitResume();
                if (!running) return;
                QueuedJob job = lane.queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (job == null) continue;
                Instant now = clock.instant();
                if (!job.start(now)) continue;
                waiting.decrementAndGet();
                recordWait(Duration.between(job.enqueuedAt(), now));
                lane.active.incrementAndGet();
                try {
                    execute(lane, job);
                } finally {
                    lane.active.decrementAndGet();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void awaitResume() throws InterruptedException {
        synchronized (pauseLock) {
            while (paused && running) pauseLock.wait(POLL_MILLIS);
        }
    }

    private void execute(Lane lane, QueuedJob job) {
        if (job.requestId() != null) MDC.put(RequestIdFilter.MDC_KEY, job.requestId());
        MDC.put("job_id", job.id().toString());
        try {
            ProviderClient client = clients.find(lane.provider)
                    .orElseThrow(() -> new IllegalStateException("No client for " + lane.provider));
            for (int index : job.outstanding()) {
                if (job.isCancelRequested()) break;
                AiRequest request = job.requests().get(index);
                try {
                    job.record(SubRequestResult.success(index, client.call(job.model(), request)));
                } catch (ProviderException e) {
                    log.debug("Job {} request {} failed (retryable={}): {}",
                            job.id(), index, e.isRetryable(), e.getMessage());
                    job.record(SubRequestResult.error(index, e.getMessage(), e.isRetryable()));
                } catch (RuntimeException e) {
                    log.error("Job {} request {} failed unexpectedly", job.id(), index, e);
                    job.record(SubRequestResult.error(index, "Unexpected error: " + e.getClass().getSimpleName(), false));
                }
            }
            finish(lane, job);
        } finally {
            MDC.remove("job_id");
            MDC.remove(RequestIdFilter.MDC_KEY);
        }
    }

    private void finish(Lane lane, QueuedJob job) {
        Duration delay = config.backoff().delayFor(job.attempts(), config.retryDelay(), config.maxRetryDelay());
        JobState state = job.finishAttempt(clock.instant(), delay);
        switch (state) {
            case RETRY_WAIT -> {
                waiting.incrementAndGet();
                log.info("Job {} attempt {}/{} had transient failures; retrying in {} ms",
                        job.id(), job.attempts(), config.maxAttempts(), delay.toMillis());
                scheduleRetry(lane, job, delay);
            }
            case COMPLETED -> {
                totalProcessed.incrementAndGet();
                log.info("Job {} completed after {} attempt(s)", job.id(), job.attempts());
                job.complete();
            }
            case FAILED -> {
                totalFailed.incrementAndGet();
                log.warn("Job {} failed after {} attempt(s)", job.id(), job.attempts());
                job.complete();
            }
            case CANCELLED -> {
                totalCancelled.incrementAndGet();
                log.info("Job {} cancelled while running", job.id());
                job.complete();
            }
            default -> throw new IllegalStateException("Unexpected state after attempt: " + state);
        }
    }

    private void scheduleRetry(Lane lane, QueuedJob job, Duration delay) {
        try {
            retryScheduler.schedule(() -> {
                if (running && job.requeue(sequence.incrementAndGet(), clock.instant())) lane.queue.offer(job);
            }, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // shutting down; shutdown() cancels retry-waiting jobs
            log.debug("Retry of job {} not scheduled: dispatcher stopping", job.id());
        }
    }

    private void recordWait(Duration wait) {
        synchronized (waitLock) {
            double sample = wait.toMillis();
            averageWaitMillis = waitSampled ? WAIT_ALPHA * sample + (1 - WAIT_ALPHA) * averageWaitMillis : sample;
            waitSampled = true;
        }
    }

    private double averageWaitMillis() {
        synchronized (waitLock) {
            return averageWaitMillis;
        }
    }

    private static CustomizableThreadFactory daemonThreads(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }

    private final class Lane {
        final String provider;
        final int concurrency;
        final PriorityBlockingQueue<QueuedJob> queue = new PriorityBlockingQueue<>(16, ORDER);
        final AtomicInteger active = new AtomicInteger();
        final ExecutorService workers;

        Lane(String provider, int concurrency) {
            this.provider = provider;
            this.concurrency = concurrency;
            this.workers = Executors.newFixedThreadPool(concurrency, daemonThreads("dispatch-" + provider + "-"));
        }

        void start() {
            Gauge.builder("relaygate.queue.active", active, AtomicInteger::get)
                    .tag("provider", provider)
                    .register(meterRegistry);
            for (int i = 0; i < concurrency; i++) workers.execute(() -> work(this));
        }
    }
}
