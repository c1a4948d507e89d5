package dev.relaygate.service;

import dev.relaygate.cache.CacheHit;
import dev.relaygate.cache.SemanticCache;
import dev.relaygate.config.GatewayConfig;
import dev.relaygate.config.GatewayProperties;
import dev.relaygate.config.RequestIdFilter;
import dev.relaygate.domain.enums.JobPriority;
import dev.relaygate.domain.enums.UsageSource;
import dev.relaygate.domain.valueobject.AiRequest;
import dev.relaygate.domain.valueobject.ProviderResponse;
import dev.relaygate.domain.valueobject.RoutingDecision;
import dev.relaygate.exception.GatewayException;
import dev.relaygate.exception.ProviderException;
import dev.relaygate.infrastructure.ai.CostOptimizer;
import dev.relaygate.infrastructure.ai.ProviderClient;
import dev.relaygate.infrastructure.ai.ProviderClientRegistry;
import dev.relaygate.infrastructure.ai.ProviderRouter;
import dev.relaygate.queue.JobHandle;
import dev.relaygate.queue.JobSnapshot;
import dev.relaygate.queue.RequestDispatcher;
import dev.relaygate.queue.SubRequestResult;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Request orchestration: cache, route, call (directly or through the dispatcher),
 * then charge the budget and populate the cache.
 *
 * <p>Design decisions:
 * <ul>
 *   <li>The cache is consulted before steering and budgets; a hit costs nothing and is never charged.</li>
 *   <li>Usage is recorded with the actual token cost after the call. A refused or failed usage
 *       write is logged and never turns a served response into an error.</li>
 *   <li>Every execution hands back a canceller so a disconnecting client stops its provider
 *       call or its queued job.</li>
 * </ul>
 */
@Service
public class GatewayService {

    private static final Logger log = LoggerFactory.getLogger(GatewayService.class);

    private final ProviderRouter router;
    private final ProviderClientRegistry clients;
    private final RequestDispatcher dispatcher;
    private final SemanticCache cache;
    private final BudgetTracker budgetTracker;
    private final CostOptimizer optimizer;
    private final GatewayProperties properties;
    private final AsyncTaskExecutor executor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public GatewayService(ProviderRouter router, ProviderClientRegistry clients, RequestDispatcher dispatcher,
                          SemanticCache cache, BudgetTracker budgetTracker, CostOptimizer optimizer,
                          GatewayProperties properties, @Qualifier("gatewayExecutor") AsyncTaskExecutor executor,
                          MeterRegistry meterRegistry, Clock clock) {
        this.router = router;
        this.clients = clients;
        this.dispatcher = dispatcher;
        this.cache = cache;
        this.budgetTracker = budgetTracker;
        this.optimizer = optimizer;
        this.properties = properties;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public record ChatResult(ProviderResponse response, boolean cached, Double similarity,
                             RoutingDecision routing, UUID jobId, BigDecimal cost) {}

    /** A running chat and the hook that aborts it. */
    public record ChatExecution(CompletableFuture<ChatResult> result, Runnable canceller) {

        static ChatExecution done(ChatResult result) {
            return new ChatExecution(CompletableFuture.completedFuture(result), () -> { });
        }
    }

    public record BatchItem(int index, boolean success, ChatResult result, String error, String type, Integer status) {}

    public record BatchResult(String batchId, List<BatchItem> results, int totalProcessed, int successful, int failed) {}

    @RateLimiter(name = GatewayConfig.RATE_LIMITER)
    public ChatExecution chat(AiRequest request) {
        return execute(request);
    }

    /**
     * Runs every request with bounded parallelism. Individual failures become error
     * items; the batch itself only fails on rate limiting.
     */
    @RateLimiter(name = GatewayConfig.RATE_LIMITER)
    public BatchResult processBatch(List<AiRequest> requests) {
        String batchId = UUID.randomUUID().toString();
        int concurrency = properties.batchConcurrency();
        List<BatchItem> items = new ArrayList<>(requests.size());
        log.info("Batch {} started with {} request(s), concurrency {}", batchId, requests.size(), concurrency);

        for (int start = 0; start < requests.size(); start += concurrency) {
            int end = Math.min(start + concurrency, requests.size());
            List<CompletableFuture<BatchItem>> chunk = new ArrayList<>(end - start);
            for (int i = start; i < end; i++) {
                int index = i;
                CompletableFuture<ChatResult> future;
                try {
                    future = execute(requests.get(i)).result();
                } catch (RuntimeException e) {
                    future = CompletableFuture.failedFuture(e);
                }
                chunk.add(future.handle((result, error) -> error == null
                        ? new BatchItem(index, true, result, null, null, 200)
                        : failedItem(index, error)));
            }
            chunk.forEach(f -> items.add(f.join()));
        }

        int successful = (int) items.stream().filter(BatchItem::success).count();
        log.info("Batch {} finished: {} succeeded, {} failed", batchId, successful, items.size() - successful);
        return new BatchResult(batchId, items, items.size(), successful, items.size() - successful);
    }

    // ── Internal ───────────────────────────────────────────────────

    private ChatExecution execute(AiRequest request) {
        Optional<CacheHit> hit = cache.lookup(request.prompt());
        if (hit.isPresent()) {
            count("cached");
            return ChatExecution.done(fromCache(request, hit.get()));
        }

        RoutingDecision decision = router.route(request);
        AiRequest routed = decision.prompt().equals(request.prompt()) ? request : request.withPrompt(decision.prompt());

        CompletableFuture<ProviderResponse> call;
        Runnable canceller;
        UUID jobId;
        Duration timeout = properties.queue().timeout();
        if (request.wantsQueue()) {
            JobPriority priority = request.routingPreferences().priority();
            JobHandle handle = dispatcher.enqueue(decision.provider(), decision.model(), List.of(routed), priority);
            jobId = handle.jobId();
            call = handle.result().thenApply(snapshot -> unwrapJob(decision.provider(), snapshot));
            canceller = () -> cancelJob(handle.jobId());
            int attempts = properties.queue().maxAttempts();
            timeout = timeout.multipliedBy(attempts).plus(properties.queue().maxRetryDelay().multipliedBy(attempts - 1L));
        } else {
            ProviderClient client = clients.find(decision.provider())
                    .orElseThrow(() -> new ProviderException(decision.provider(), "Provider is not configured", false));
            jobId = null;
            CompletableFuture<ProviderResponse> direct = new CompletableFuture<>();
            Future<?> task = executor.submit(() -> {
                try {
                    direct.complete(client.call(decision.model(), routed));
                } catch (RuntimeException e) {
                    direct.completeExceptionally(e);
                }
            });
            call = direct;
            canceller = () -> {
                task.cancel(true);
                direct.cancel(false);
            };
        }

        Runnable cancel = canceller;
        Duration limit = timeout;
        CompletableFuture<ChatResult> result = call
                .orTimeout(limit.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((response, error) -> {
                    if (unwrap(error) instanceof TimeoutException) {
                        log.warn("Request {} timed out after {} on {}", request.id(), limit,
                                decision.provider());
                        cancel.run();
                    }
                })
                .thenApply(response -> complete(request, decision, response, jobId));
        String requestId = MDC.get(RequestIdFilter.MDC_KEY);
        result.whenComplete((r, error) -> {
            if (error != null) {
                count("failed");
                log.debug("Request {} ({}) failed: {}", request.id(), requestId, unwrap(error).toString());
            }
        });
        return new ChatExecution(result, cancel);
    }

    private ChatResult complete(AiRequest request, RoutingDecision decision, ProviderResponse response, UUID jobId) {
        // providers that report no usage are charged the routing estimate
        BigDecimal cost = response.totalTokens() > 0
                ? optimizer.costOf(response.provider(), response.model(), response.totalTokens())
                : decision.estimatedCost();
        if (decision.budgetId() != null && cost.signum() > 0) charge(request, decision, response, cost);
        cache.store(request.prompt(), response);
        count("served");
        return new ChatResult(response, false, null, decision, jobId, cost);
    }

    private void charge(AiRequest request, RoutingDecision decision, ProviderResponse response, BigDecimal cost) {
        try {
            budgetTracker.recordUsage(decision.budgetId(), cost, null, UsageSource.GATEWAY_INTERNAL, clock.instant(),
                    new BudgetTracker.UsageDetails("chat completion", request.id(), response.provider(), response.model()));
        } catch (GatewayException e) {
            // the response was already produced; the ledger refusal is reported, not propagated
            log.warn("Usage of {} for request {} not recorded on budget {}: {}",
                    cost, request.id(), decision.budgetId(), e.getMessage());
        }
    }

    private ChatResult fromCache(AiRequest request, CacheHit hit) {
        ProviderResponse cached = hit.response();
        String reason = "semantic cache hit with similarity %s".formatted(
                String.format(Locale.ROOT, "%.3f", hit.similarity()));
        RoutingDecision decision = new RoutingDecision(cached.provider(), cached.model(), BigDecimal.ZERO,
                List.of(reason), null, request.prompt(), List.of());
        log.debug("Request {} served from cache", request.id());
        return new ChatResult(cached, true, hit.similarity(), decision, null, BigDecimal.ZERO);
    }

    private static ProviderResponse unwrapJob(String provider, JobSnapshot snapshot) {
        SubRequestResult result = snapshot.results().get(0);
        return switch (result.status()) {
            case SUCCESS -> result.payload();
            case CANCELLED -> throw new CancellationException("Job " + snapshot.id() + " was cancelled");
            default -> throw new ProviderException(provider, result.error() != null ? result.error() : "Job failed",
                    Boolean.TRUE.equals(result.retryable()));
        };
    }

    private void cancelJob(UUID jobId) {
        if (dispatcher.getStatus(jobId).isPresent()) dispatcher.cancel(jobId);
    }

    private BatchItem failedItem(int index, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof GatewayException ge)
            return new BatchItem(index, false, null, ge.getMessage(), ge.getType(), ge.getStatus().value());
        if (cause instanceof TimeoutException)
            return new BatchItem(index, false, null, "Provider call timed out", "timeout", 504);
        if (cause instanceof CancellationException)
            return new BatchItem(index, false, null, "Cancelled", "cancelled", 499);
        log.error("Batch item {} failed unexpectedly", index, cause);
        return new BatchItem(index, false, null, "An unexpected error occurred", "internal", 500);
    }

    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) current = current.getCause();
        return current;
    }

    private void count(String outcome) {
        meterRegistry.counter("relaygate.requests", "outcome", outcome).increment();
    }
}
