package dev.relaygate.cache;

import dev.relaygate.config.GatewayProperties;
import dev.relaygate.domain.valueobject.ProviderResponse;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Drives the cache with hand-placed vectors so similarity values are exact.
 */
class SemanticCacheTest {

    private MutableClock clock;
    private FixedEmbeddings embeddings;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-15T12:00:00Z"));
        embeddings = new FixedEmbeddings();
        embeddings.put("what is java", 1f, 0f);
        embeddings.put("what is java exactly", 0.9f, 0.4359f);   // cosine ~0.90
        embeddings.put("tell me about java", 0.5f, 0.866f);      // cosine 0.50
        embeddings.put("what is java again", 0.99f, 0.141f);     // cosine ~0.99
    }

    @Nested
    @DisplayName("lookup")
    class Lookup {

        @Test
        @DisplayName("an exact prompt hits after whitespace and case normalization")
        void exactHit() {
            SemanticCache cache = cache(10, Duration.ofMinutes(30));
            cache.store("What is Java", response("A language"));

            assertThat(cache.lookup("  what   IS java ")).hasValueSatisfying(hit -> {
                assertThat(hit.similarity()).isEqualTo(1.0);
                assertThat(hit.response().content()).isEqualTo("A language");
                assertThat(hit.storedPrompt()).isEqualTo("What is Java");
            });
            assertThat(cache.hitCount("what is java")).isEqualTo(1);
        }

        @Test
        @DisplayName("a similar prompt at or above the threshold hits, a dissimilar one misses")
        void similarityThreshold() {
            SemanticCache cache = cache(10, Duration.ofMinutes(30));
            cache.store("what is java", response("A language"));

            assertThat(cache.lookup("what is java exactly")).hasValueSatisfying(hit ->
                    assertThat(hit.similarity()).isCloseTo(0.9, within(0.001)));
            assertThat(cache.lookup("tell me about java")).isEmpty();

            CacheStats stats = cache.stats();
            assertThat(stats.hits()).isEqualTo(1);
            assertThat(stats.misses()).isEqualTo(1);
            assertThat(stats.hitRate()).isEqualTo(0.5);
        }

        @Test
        @DisplayName("the most similar live entry wins")
        void bestMatch() {
            SemanticCache cache = cache(10, Duration.ofMinutes(30));
            cache.store("what is java exactly", response("close"));
            cache.store("what is java", response("closest"));

            assertThat(cache.lookup("what is java again"))
                    .hasValueSatisfying(hit -> assertThat(hit.response().content()).isEqualTo("closest"));
        }

        @Test
        @DisplayName("expired entries never hit and are swept")
        void expiry() {
            SemanticCache cache = cache(10, Duration.ofMinutes(5));
            cache.store("what is java", response("A language"));

            clock.advance(Duration.ofMinutes(5));

            assertThat(cache.lookup("what is java")).isEmpty();
            cache.evictExpired();
            assertThat(cache.stats().size()).isZero();
        }

        @Test
        @DisplayName("an embedding failure is a miss, not an error")
        void embeddingFailure() {
            SemanticCache cache = cache(10, Duration.ofMinutes(30));
            cache.store("what is java", response("A language"));

            assertThat(cache.lookup("never seen before")).isEmpty();
            assertThat(cache.stats().misses()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("storage")
    class Storage {

        @Test
        @DisplayName("at capacity the least recently accessed entry is evicted")
        void lruEviction() {
            SemanticCache cache = cache(2, Duration.ofMinutes(30));
            cache.store("what is java", response("a"));
            clock.advance(Duration.ofSeconds(1));
            cache.store("tell me about java", response("b"));
            clock.advance(Duration.ofSeconds(1));
            cache.lookup("what is java");
            clock.advance(Duration.ofSeconds(1));

            cache.store("what is java again", response("c"));

            assertThat(cache.stats().size()).isEqualTo(2);
            assertThat(cache.stats().evictions()).isEqualTo(1);
            assertThat(cache.hitCount("tell me about java")).isEqualTo(-1);
            assertThat(cache.hitCount("what is java")).isEqualTo(1);
        }

        @Test
        @DisplayName("re-storing a prompt replaces it without evicting")
        void replaceInPlace() {
            SemanticCache cache = cache(1, Duration.ofMinutes(30));
            cache.store("what is java", response("old"));
            cache.store("what is java", response("new"));

            assertThat(cache.stats().evictions()).isZero();
            assertThat(cache.lookup("what is java"))
                    .hasValueSatisfying(hit -> assertThat(hit.response().content()).isEqualTo("new"));
        }

        @Test
        @DisplayName("concurrent stores of distinct prompts stay within capacity")
        void concurrentStores() throws Exception {
            GatewayProperties.Cache config = new GatewayProperties.Cache(true, 0.8, 20, Duration.ofMinutes(30), 1000, null);
            SemanticCache cache = new SemanticCache(new UniformEmbeddings(),
                    new GatewayProperties(null, config, null, null, null, null, 0), new SimpleMeterRegistry(), clock);
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int t = 0; t < 8; t++) {
                    int thread = t;
                    futures.add(pool.submit(() -> {
                        for (int i = 0; i < 50; i++) cache.store("prompt " + thread + "-" + i, response("r"));
                    }));
                }
                for (Future<?> future : futures) future.get(10, TimeUnit.SECONDS);
            } finally {
                pool.shutdownNow();
            }

            assertThat(cache.stats().size()).isEqualTo(20);
            assertThat(cache.stats().evictions()).isEqualTo(380);
        }

        @Test
        @DisplayName("embeddings are memoized per normalized prompt")
        void memoization() {
            SemanticCache cache = cache(10, Duration.ofMinutes(30));
            cache.store("what is java", response("a"));
            cache.lookup("tell me about java");
            cache.lookup("Tell me  about java");

            assertThat(embeddings.calls).containsEntry("what is java", 1).containsEntry("tell me about java", 1);
        }

        @Test
        @DisplayName("a disabled cache neither stores nor hits")
        void disabled() {
            GatewayProperties.Cache config = new GatewayProperties.Cache(false, null, null, null, null, null);
            SemanticCache cache = new SemanticCache(embeddings,
                    new GatewayProperties(null, config, null, null, null, null, 0), new SimpleMeterRegistry(), clock);
            cache.store("what is java", response("a"));

            assertThat(cache.lookup("what is java")).isEmpty();
            assertThat(cache.stats().enabled()).isFalse();
            assertThat(cache.stats().size()).isZero();
        }

        @Test
        @DisplayName("clear drops every entry")
        void clear() {
            SemanticCache cache = cache(10, Duration.ofMinutes(30));
            cache.store("what is java", response("a"));
            cache.clear();

            assertThat(cache.lookup("what is java")).isEmpty();
        }
    }

    // ── Test Fixtures ──────────────────────────────────────────────

    private SemanticCache cache(int maxSize, Duration ttl) {
        GatewayProperties.Cache config = new GatewayProperties.Cache(true, 0.8, maxSize, ttl, 100, null);
        return new SemanticCache(embeddings, new GatewayProperties(null, config, null, null, null, null, 0),
                new SimpleMeterRegistry(), clock);
    }

    private static ProviderResponse response(String content) {
        return new ProviderResponse(content, "openai", "gpt-4o-mini", 10, 20, Duration.ofMillis(100));
    }

    private static final class FixedEmbeddings implements EmbeddingProvider {
        private final Map<String, float[]> vectors = new HashMap<>();
        final Map<String, Integer> calls = new HashMap<>();

        void put(String text, float x, float y) {
            vectors.put(text, new float[]{x, y});
        }

        @Override
        public float[] embed(String text) {
            calls.merge(text, 1, Integer::sum);
            float[] vector = vectors.get(text);
            if (vector == null) throw new IllegalStateException("no vector for " + text);
            return vector;
        }

        @Override
        public String name() {
            return "fixed";
        }
    }

    private static final class UniformEmbeddings implements EmbeddingProvider {
        @Override
        public float[] embed(String text) {
            return new float[]{1f, 0f};
        }

        @Override
        public String name() {
            return "uniform";
        }
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
