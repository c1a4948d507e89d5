package dev.relaygate.queue;

import dev.relaygate.config.GatewayProperties;
import dev.relaygate.domain.enums.BackoffStrategy;
import dev.relaygate.domain.enums.JobPriority;
import dev.relaygate.domain.enums.JobState;
import dev.relaygate.domain.valueobject.AiRequest;
import dev.relaygate.domain.valueobject.ProviderResponse;
import dev.relaygate.exception.NotFoundException;
import dev.relaygate.exception.ProviderException;
import dev.relaygate.exception.QueueFullException;
import dev.relaygate.exception.ValidationException;
import dev.relaygate.infrastructure.ai.ProviderClient;
import dev.relaygate.infrastructure.ai.ProviderClientRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs a real dispatcher against a scripted provider. Retry delays are a few
 * milliseconds so the retry paths complete quickly.
 */
class RequestDispatcherTest {

    private static final String PROVIDER = "fake";

    private RequestDispatcher dispatcher;
    private ScriptedClient client;

    @AfterEach
    void tearDown() {
        if (dispatcher != null) dispatcher.shutdown();
    }

    @Nested
    @DisplayName("execution and retries")
    class Execution {

        @Test
        @DisplayName("a successful job completes with its payload")
        void completes() throws Exception {
            start(3, 10, request -> response(request.prompt().toUpperCase()));

            JobSnapshot snapshot = await(dispatcher.enqueue(PROVIDER, "m1", List.of(AiRequest.of("hello")),
                    JobPriority.NORMAL));

            assertThat(snapshot.state()).isEqualTo(JobState.COMPLETED);
            assertThat(snapshot.attempts()).isEqualTo(1);
            assertThat(snapshot.results()).singleElement()
                    .satisfies(r -> assertThat(r.payload().content()).isEqualTo("HELLO"));
        }

        @Test
        @DisplayName("transient failures are retried up to the attempt limit, then the job fails")
        void retriesThenFails() throws Exception {
            start(3, 10, request -> {
                throw new ProviderException(PROVIDER, "503 from upstream", true);
            });

            JobSnapshot snapshot = await(dispatcher.enqueue(PROVIDER, "m1", List.of(AiRequest.of("hello")), null));

            assertThat(snapshot.state()).isEqualTo(JobState.FAILED);
            assertThat(snapshot.attempts()).isEqualTo(3);
            assertThat(client.calls).hasSize(3);
            assertThat(snapshot.results().get(0).retryable()).isTrue();
            assertThat(dispatcher.metrics().totalFailed()).isEqualTo(1);
        }

        @Test
        @DisplayName("a transient failure followed by success completes on the second attempt")
        void recoversOnRetry() throws Exception {
            Deque<Boolean> failFirst = new ArrayDeque<>(List.of(true));
            start(3, 10, request -> {
                if (!failFirst.isEmpty() && failFirst.poll()) throw new ProviderException(PROVIDER, "timeout", true);
                return response("ok");
            });

            JobSnapshot snapshot = await(dispatcher.enqueue(PROVIDER, "m1", List.of(AiRequest.of("hello")), null));

            assertThat(snapshot.state()).isEqualTo(JobState.COMPLETED);
            assertThat(snapshot.attempts()).isEqualTo(2);
        }

        @Test
        @DisplayName("non-retryable failures are not retried")
        void permanentFailure() throws Exception {
            start(3, 10, request -> {
                throw new ProviderException(PROVIDER, "400 bad request", false);
            });

            JobSnapshot snapshot = await(dispatcher.enqueue(PROVIDER, "m1", List.of(AiRequest.of("hello")), null));

            assertThat(snapshot.state()).isEqualTo(JobState.FAILED);
            assertThat(snapshot.attempts()).isEqualTo(1);
            assertThat(client.calls).hasSize(1);
        }

        @Test
        @DisplayName("a job with one permanent failure among successes still completes")
        void partialSuccess() throws Exception {
            start(3, 10, request -> {
                if (request.prompt().equals("bad")) throw new ProviderException(PROVIDER, "rejected", false);
                return response(request.prompt());
            });

            JobSnapshot snapshot = await(dispatcher.enqueue(PROVIDER, "m1",
                    List.of(AiRequest.of("first"), AiRequest.of("bad"), AiRequest.of("third")), JobPriority.HIGH));

            assertThat(snapshot.state()).isEqualTo(JobState.COMPLETED);
            assertThat(snapshot.successful()).isEqualTo(2);
            assertThat(snapshot.failed()).isEqualTo(1);
            assertThat(snapshot.results()).extracting(SubRequestResult::status).containsExactly(
                    SubRequestResult.Status.SUCCESS, SubRequestResult.Status.ERROR, SubRequestResult.Status.SUCCESS);
        }

        @Test
        @DisplayName("only failed sub-requests are re-run on retry")
        void retriesOnlyFailedRequests() throws Exception {
            Deque<Boolean> failSecondOnce = new ArrayDeque<>(List.of(true));
            start(3, 10, request -> {
                if (request.prompt().equals("second") && !failSecondOnce.isEmpty() && failSecondOnce.poll())
                    throw new ProviderException(PROVIDER, "429", true);
                return response(request.prompt());
            });

            JobSnapshot snapshot = await(dispatcher.enqueue(PROVIDER, "m1",
                    List.of(AiRequest.of("first"), AiRequest.of("second")), null));

            assertThat(snapshot.state()).isEqualTo(JobState.COMPLETED);
            assertThat(client.calls).containsExactly("first", "second", "second");
        }
    }

    @Nested
    @DisplayName("queue control")
    class Control {

        @Test
        @DisplayName("higher priority jobs run first")
        void priorityOrder() throws Exception {
            start(10, 10, request -> response(request.prompt()));
            pauseAndSettle();

            JobHandle low = dispatcher.enqueue(PROVIDER, "m1", List.of(AiRequest.of("low")), JobPriority.LOW);
            JobHandle normal = dispatcher.enqueue(PROVIDER, "m1", List.of(AiRequest.of("normal")), JobPriority.NORMAL);
            JobHandle high = dispatcher.enqueue(PROVIDER, "m1", List.of(AiRequest.of("high")), JobPriority.HIGH);
            JobHandle normal2 = dispatcher.enqueue(PROVIDER, "m1", List.of(AiRequest.of("normal-2")), null);
            dispatcher.resume();
            await(low);
            await(normal);
            await(high);
            await(normal2);

            assertThat(client.calls).containsExactly("high", "normal", "normal-2", "low");
        }

        @Test
        @DisplayName("a cancelled waiting job never runs")
        void cancelWaiting() throws Exception {
            start(10, 10, request -> response(request.prompt()));
            pauseAndSettle();

            JobHandle handle = dispatcher.enqueue(PROVIDER, "m1", List.of(AiRequest.of("doomed")), null);
            assertThat(dispatcher.cancel(handle.jobId())).isTrue();
            dispatcher.resume();

            JobSnapshot snapshot = await(handle);
            assertThat(snapshot.state()).isEqualTo(JobState.CANCELLED);
            assertThat(snapshot.results()).extracting(SubRequestResult::status)
                    .containsExactly(SubRequestResult.Status.CANCELLED);
            assertThat(dispatcher.cancel(handle.jobId())).isFalse();
            assertThat(client.calls).isEmpty();
            assertThat(dispatcher.metrics().waiting()).isZero();
        }

        @Test
        @DisplayName("cancelling a running job lets the in-flight call finish and cancels the rest")
        void cancelRunning() throws Exception {
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            start(10, 10, request -> {
                started.countDown();
                awaitLatch(release);
                return response(request.prompt());
            });

            JobHandle handle = dispatcher.enqueue(PROVIDER, "m1",
                    List.of(AiRequest.of("a"), AiRequest.of("b"), AiRequest.of("c")), null);
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(dispatcher.cancel(handle.jobId())).isTrue();
            release.countDown();

            JobSnapshot snapshot = await(handle);
            assertThat(snapshot.state()).isEqualTo(JobState.CANCELLED);
            assertThat(snapshot.results()).extracting(SubRequestResult::status).containsExactly(
                    SubRequestResult.Status.SUCCESS, SubRequestResult.Status.CANCELLED,
                    SubRequestResult.Status.CANCELLED);
            assertThat(client.calls).containsExactly("a");
        }

        @Test
        @DisplayName("a cancel arriving after the last call finished leaves the job completed")
        void cancelTooLate() throws Exception {
            AtomicReference<UUID> jobId = new AtomicReference<>();
            start(10, 10, request -> {
                dispatcher.cancel(jobId.get());
                return response(request.prompt());
            });
            pauseAndSettle();

            JobHandle handle = dispatcher.enqueue(PROVIDER, "m1", List.of(AiRequest.of("only")), null);
            jobId.set(handle.jobId());
            dispatcher.resume();

            JobSnapshot snapshot = await(handle);
            assertThat(snapshot.state()).isEqualTo(JobState.COMPLETED);
            assertThat(snapshot.results()).extracting(SubRequestResult::status)
                    .containsExactly(SubRequestResult.Status.SUCCESS);
        }

        @Test
        @DisplayName("enqueue beyond the size limit is refused")
        void queueFull() {
            start(2, 10, request -> response(request.prompt()));
            pauseAndSettle();

            dispatcher.enqueue(PROVIDER, "m1", List.of(AiRequest.of("a")), null);
            dispatcher.enqueue(PROVIDER, "m1", List.of(AiRequest.of("b")), null);

            assertThatThrownBy(() -> dispatcher.enqueue(PROVIDER, "m1", List.of(AiRequest.of("c")), null))
                    .isInstanceOf(QueueFullException.class);
            assertThat(dispatcher.metrics().queueSizeByPriority()).containsEntry("normal", 2);
        }

        @Test
        @DisplayName("clear cancels every waiting job")
        void clearWaiting() {
            start(10, 10, request -> response(request.prompt()));
            pauseAndSettle();
            dispatcher.enqueue(PROVIDER, "m1", List.of(AiRequest.of("a")), null);
            dispatcher.enqueue(PROVIDER, "m1", List.of(AiRequest.of("b")), JobPriority.LOW);

            assertThat(dispatcher.clear()).isEqualTo(2);
            assertThat(dispatcher.metrics().totalCancelled()).isEqualTo(2);
        }

        @Test
        @DisplayName("unknown providers and empty jobs are validation errors")
        void validation() {
            start(10, 10, request -> response(request.prompt()));

            assertThatThrownBy(() -> dispatcher.enqueue("nope", "m1", List.of(AiRequest.of("a")), null))
                    .isInstanceOfSatisfying(ValidationException.class, e ->
                            assertThat(e.properties()).containsEntry("validProviders", List.of(PROVIDER)));
            assertThatThrownBy(() -> dispatcher.enqueue(PROVIDER, "m1", List.of(), null))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> dispatcher.cancel(UUID.randomUUID()))
                    .isInstanceOf(NotFoundException.class);
        }
    }

    // ── Test Fixtures ──────────────────────────────────────────────

    private void start(int maxSize, long retryMillis, Function<AiRequest, ProviderResponse> behaviour) {
        client = new ScriptedClient(behaviour);
        GatewayProperties.Queue queue = new GatewayProperties.Queue(maxSize, Map.of(PROVIDER, 1),
                Duration.ofSeconds(2), 3, BackoffStrategy.FIXED, Duration.ofMillis(retryMillis),
                Duration.ofMillis(retryMillis * 5));
        GatewayProperties properties = new GatewayProperties(null, null, queue, null, null, null, 0);
        dispatcher = new RequestDispatcher(new ProviderClientRegistry(Map.of(PROVIDER, client)), properties,
                new SimpleMeterRegistry(), Clock.systemUTC());
        dispatcher.start();
    }

    /** Pauses and waits out any poll already in flight so no worker can take the next job. */
    private void pauseAndSettle() {
        dispatcher.pause();
        try {
            Thread.sleep(500);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void awaitLatch(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) throw new IllegalStateException("latch not released");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static JobSnapshot await(JobHandle handle) throws Exception {
        return handle.result().get(5, TimeUnit.SECONDS);
    }

    private static ProviderResponse response(String content) {
        return new ProviderResponse(content, PROVIDER, "m1", 3, 4, Duration.ofMillis(5));
    }

    private static final class ScriptedClient implements ProviderClient {
        final List<String> calls = new CopyOnWriteArrayList<>();
        private final Function<AiRequest, ProviderResponse> behaviour;

        ScriptedClient(Function<AiRequest, ProviderResponse> behaviour) {
            this.behaviour = behaviour;
        }

        @Override
        public String provider() {
            return PROVIDER;
        }

        @Override
        public ProviderResponse call(String model, AiRequest request) {
            calls.add(request.prompt());
            return behaviour.apply(request);
        }
    }
}
