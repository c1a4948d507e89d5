package dev.relaygate.service;

import dev.relaygate.cache.CacheHit;
import dev.relaygate.cache.SemanticCache;
import dev.relaygate.config.GatewayProperties;
import dev.relaygate.domain.enums.JobPriority;
import dev.relaygate.domain.enums.JobState;
import dev.relaygate.domain.enums.UsageSource;
import dev.relaygate.domain.valueobject.AiRequest;
import dev.relaygate.domain.valueobject.ProviderResponse;
import dev.relaygate.domain.valueobject.RoutingDecision;
import dev.relaygate.exception.BudgetExceededException;
import dev.relaygate.exception.ProviderException;
import dev.relaygate.exception.RequestRejectedException;
import dev.relaygate.infrastructure.ai.CostOptimizer;
import dev.relaygate.infrastructure.ai.ProviderClient;
import dev.relaygate.infrastructure.ai.ProviderClientRegistry;
import dev.relaygate.infrastructure.ai.ProviderRouter;
import dev.relaygate.queue.JobHandle;
import dev.relaygate.queue.JobSnapshot;
import dev.relaygate.queue.RequestDispatcher;
import dev.relaygate.queue.SubRequestResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GatewayServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-15T12:00:00Z");

    @Mock private ProviderRouter router;
    @Mock private RequestDispatcher dispatcher;
    @Mock private SemanticCache cache;
    @Mock private BudgetTracker budgetTracker;
    @Mock private CostOptimizer optimizer;
    @Mock private ProviderClient openAi;

    private GatewayService service;

    @BeforeEach
    void setUp() {
        service = new GatewayService(router, new ProviderClientRegistry(Map.of("openai", openAi)), dispatcher,
                cache, budgetTracker, optimizer, new GatewayProperties(null, null, null, null, null, null, 2),
                new SimpleAsyncTaskExecutor("test-gateway-"), new SimpleMeterRegistry(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("chat")
    class Chat {

        @Test
        @DisplayName("a cache hit is served without routing or charging")
        void cacheHit() throws Exception {
            when(cache.lookup("hello")).thenReturn(Optional.of(
                    new CacheHit(response("cached answer", 5, 5), 0.93, "Hello")));

            GatewayService.ChatResult result = await(service.chat(AiRequest.of("hello")));

            assertThat(result.cached()).isTrue();
            assertThat(result.similarity()).isEqualTo(0.93);
            assertThat(result.cost()).isEqualByComparingTo("0");
            assertThat(result.routing().reasoning()).singleElement().asString().contains("0.930");
            verifyNoInteractions(router, budgetTracker, openAi);
        }

        @Test
        @DisplayName("a direct call charges the actual token cost and populates the cache")
        void directCall() throws Exception {
            UUID budgetId = UUID.randomUUID();
            when(router.route(any())).thenReturn(decision(budgetId, "hello"));
            when(openAi.call(eq("gpt-4"), any())).thenReturn(response("hi there", 400, 600));
            when(optimizer.costOf("openai", "gpt-4", 1000)).thenReturn(new BigDecimal("0.03"));

            GatewayService.ChatResult result = await(service.chat(AiRequest.of("hello")));

            assertThat(result.cached()).isFalse();
            assertThat(result.response().content()).isEqualTo("hi there");
            assertThat(result.cost()).isEqualByComparingTo("0.03");
            verify(budgetTracker).recordUsage(eq(budgetId), eq(new BigDecimal("0.03")), isNull(),
                    eq(UsageSource.GATEWAY_INTERNAL), eq(NOW), any());
            verify(cache).store(eq("hello"), any());
        }

        @Test
        @DisplayName("a provider reporting no usage is charged the routing estimate")
        void zeroTokensChargedEstimate() throws Exception {
            UUID budgetId = UUID.randomUUID();
            when(router.route(any())).thenReturn(decision(budgetId, "hello"));
            when(openAi.call(eq("gpt-4"), any())).thenReturn(response("hi", 0, 0));

            GatewayService.ChatResult result = await(service.chat(AiRequest.of("hello")));

            assertThat(result.cost()).isEqualByComparingTo("0.01");
            verify(optimizer, never()).costOf(any(), any(), anyLong());
            verify(budgetTracker).recordUsage(eq(budgetId), eq(new BigDecimal("0.01")), isNull(),
                    eq(UsageSource.GATEWAY_INTERNAL), eq(NOW), any());
        }

        @Test
        @DisplayName("a refused usage write does not fail a served response")
        void usageRefusalIsLogged() throws Exception {
            UUID budgetId = UUID.randomUUID();
            when(router.route(any())).thenReturn(decision(budgetId, "hello"));
            when(openAi.call(eq("gpt-4"), any())).thenReturn(response("hi", 10, 10));
            when(optimizer.costOf("openai", "gpt-4", 20)).thenReturn(new BigDecimal("0.0006"));
            when(budgetTracker.recordUsage(any(), any(), any(), any(), any(), any()))
                    .thenThrow(new BudgetExceededException(budgetId, BigDecimal.ZERO, new BigDecimal("0.0006"),
                            List.of(budgetId)));

            GatewayService.ChatResult result = await(service.chat(AiRequest.of("hello")));

            assertThat(result.response().content()).isEqualTo("hi");
        }

        @Test
        @DisplayName("a prompt rewritten by steering is what the provider receives")
        void rewrittenPrompt() throws Exception {
            when(router.route(any())).thenReturn(decision(null, "Be brief. hello"));
            when(openAi.call(eq("gpt-4"), any())).thenAnswer(invocation -> {
                AiRequest sent = invocation.getArgument(1);
                return response("echo: " + sent.prompt(), 1, 1);
            });
            when(optimizer.costOf("openai", "gpt-4", 2)).thenReturn(new BigDecimal("0.00006"));

            GatewayService.ChatResult result = await(service.chat(AiRequest.of("hello")));

            assertThat(result.response().content()).isEqualTo("echo: Be brief. hello");
            verifyNoInteractions(budgetTracker);
        }

        @Test
        @DisplayName("a queued request runs through the dispatcher and reports its job id")
        void queuedRequest() throws Exception {
            UUID jobId = UUID.randomUUID();
            when(router.route(any())).thenReturn(decision(null, "hello"));
            JobSnapshot done = new JobSnapshot(jobId, "openai", "gpt-4", JobPriority.HIGH, JobState.COMPLETED,
                    1, 2, List.of(SubRequestResult.success(0, response("queued answer", 3, 3))),
                    NOW, NOW, NOW, null);
            when(dispatcher.enqueue(eq("openai"), eq("gpt-4"), any(), eq(JobPriority.HIGH)))
                    .thenReturn(new JobHandle(jobId, CompletableFuture.completedFuture(done)));
            when(optimizer.costOf("openai", "gpt-4", 6)).thenReturn(new BigDecimal("0.00018"));
            AiRequest request = new AiRequest(null, "hello", null,
                    new AiRequest.RoutingPreferences(null, null, JobPriority.HIGH, null, null), null, null, null);

            GatewayService.ChatResult result = await(service.chat(request));

            assertThat(result.jobId()).isEqualTo(jobId);
            assertThat(result.response().content()).isEqualTo("queued answer");
            verifyNoInteractions(openAi);
        }
    }

    @Nested
    @DisplayName("batch")
    class Batch {

        @Test
        @DisplayName("a failing item is reported in place while the others succeed")
        void partialFailure() {
            when(router.route(any())).thenAnswer(invocation -> {
                AiRequest request = invocation.getArgument(0);
                return decision(null, request.prompt());
            });
            when(openAi.call(eq("gpt-4"), any())).thenAnswer(invocation -> {
                AiRequest sent = invocation.getArgument(1);
                if (sent.prompt().equals("second")) throw new ProviderException("openai", "upstream 500", true);
                return response("ok " + sent.prompt(), 1, 1);
            });
            when(optimizer.costOf("openai", "gpt-4", 2)).thenReturn(new BigDecimal("0.00006"));

            GatewayService.BatchResult result = service.processBatch(
                    List.of(AiRequest.of("first"), AiRequest.of("second"), AiRequest.of("third")));

            assertThat(result.totalProcessed()).isEqualTo(3);
            assertThat(result.successful()).isEqualTo(2);
            assertThat(result.failed()).isEqualTo(1);
            assertThat(result.results()).extracting(GatewayService.BatchItem::index).containsExactly(0, 1, 2);
            GatewayService.BatchItem failed = result.results().get(1);
            assertThat(failed.success()).isFalse();
            assertThat(failed.status()).isEqualTo(502);
            assertThat(failed.error()).contains("upstream 500");
        }

        @Test
        @DisplayName("a routing refusal becomes an error item with its own status")
        void routingRefusal() {
            when(router.route(any())).thenAnswer(invocation -> {
                AiRequest request = invocation.getArgument(0);
                if (request.prompt().equals("forbidden")) throw new RequestRejectedException("Not allowed", 403);
                return decision(null, request.prompt());
            });
            when(openAi.call(eq("gpt-4"), any())).thenReturn(response("ok", 1, 1));
            when(optimizer.costOf("openai", "gpt-4", 2)).thenReturn(new BigDecimal("0.00006"));

            GatewayService.BatchResult result = service.processBatch(
                    List.of(AiRequest.of("forbidden"), AiRequest.of("fine")));

            assertThat(result.successful()).isEqualTo(1);
            assertThat(result.results().get(0).status()).isEqualTo(403);
            assertThat(result.results().get(0).type()).isEqualTo("rejected");
        }
    }

    // ── Test Fixtures ──────────────────────────────────────────────

    private static GatewayService.ChatResult await(GatewayService.ChatExecution execution) throws Exception {
        return execution.result().get(5, TimeUnit.SECONDS);
    }

    private static RoutingDecision decision(UUID budgetId, String prompt) {
        return new RoutingDecision("openai", "gpt-4", new BigDecimal("0.01"), List.of("test routing"),
                budgetId, prompt, List.of());
    }

    private static ProviderResponse response(String content, int promptTokens, int completionTokens) {
        return new ProviderResponse(content, "openai", "gpt-4", promptTokens, completionTokens,
                Duration.ofMillis(40));
    }
}
