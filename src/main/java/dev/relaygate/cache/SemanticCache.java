package dev.relaygate.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.relaygate.config.GatewayProperties;
import dev.relaygate.domain.valueobject.ProviderResponse;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory response cache matched by prompt similarity.
 *
 * <p>Design decisions:
 * <ul>
 *   <li>Entries are keyed by the normalized prompt; an exact key match skips the similarity scan.</li>
 *   <li>A hit is the most similar live entry whose cosine similarity reaches the threshold.</li>
 *   <li>At capacity the least recently accessed entry is evicted; expired entries are dropped
 *       lazily on lookup and by the scheduled sweep. Stores lock only their own key, the
 *       eviction step is the one global section.</li>
 *   <li>Embeddings are memoized in a size-bounded Caffeine cache.</li>
 *   <li>Embedding failures degrade to a miss and never fail the request.</li>
 * </ul>
 */
@Component
public class SemanticCache {

    private static final Logger log = LoggerFactory.getLogger(SemanticCache.class);

    private final EmbeddingProvider embeddings;
    private final GatewayProperties.Cache config;
    private final Clock clock;
    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Cache<String, float[]> memo;
    private final Object evictionLock = new Object();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final Counter hitCounter;
    private final Counter missCounter;

    public SemanticCache(EmbeddingProvider embeddings, GatewayProperties properties,
                         MeterRegistry meterRegistry, Clock clock) {
        this.embeddings = embeddings;
        this.config = properties.cache();
        this.clock = clock;
        this.memo = Caffeine.newBuilder()
                .maximumSize(config.embeddingMemoSize())
                .build();
        this.hitCounter = Counter.builder("relaygate.cache.hits").register(meterRegistry);
        this.missCounter = Counter.builder("relaygate.cache.misses").register(meterRegistry);
        log.info("Semantic cache {} (threshold {}, max {}, ttl {}, embedding {})",
                config.enabled() ? "enabled" : "disabled", config.similarityThreshold(),
                config.maxSize(), config.ttl(), embeddings.name());
    }

    public Optional<CacheHit> lookup(String prompt) {
        if (!config.enabled() || prompt == null || prompt.isBlank()) return Optional.empty();
        Instant now = clock.instant();
        String key = normalize(prompt);

        Entry exact = entries.get(key);
        if (exact != null && !exact.isExpired(now)) return hit(exact, 1.0, now);

        float[] query;
        try {
            query = embed(key);
        } catch (RuntimeException e) {
            log.warn("Embedding failed during cache lookup, treating as miss: {}", e.getMessage());
            return miss();
        }

        Entry best = null;
        double bestSimilarity = -1;
        for (Entry entry : entries.values()) {
            if (entry.isExpired(now)) {
                entries.remove(entry.key, entry);
                continue;
            }
            double similarity = cosine(query, entry.embedding);
            if (similarity > bestSimilarity) {
                bestSimilarity = similarity;
                best = entry;
            }
        }
        if (best != null && bestSimilarity >= config.similarityThreshold()) return hit(best, bestSimilarity, now);
        return miss();
    }

    public void store(String prompt, ProviderResponse response) {
        if (!config.enabled() || prompt == null || prompt.isBlank() || response == null) return;
        String key = normalize(prompt);
        float[] embedding;
        try {
            embedding = embed(key);
        } catch (RuntimeException e) {
            log.warn("Embedding failed, response not cached: {}", e.getMessage());
            return;
        }
        Entry stored = new Entry(key, prompt, embedding, response, clock.instant());
        boolean added = entries.put(key, stored) == null;
        if (added) {
            synchronized (evictionLock) {
                while (entries.size() > config.maxSize()) {
                    if (!evictLeastRecentlyUsed(key)) break;
                }
            }
        }
        log.debug("Cached response for prompt of {} chars", prompt.length());
    }

    public CacheStats stats() {
        long h = hits.get();
        long m = misses.get();
        double hitRate = h + m == 0 ? 0.0 : (double) h / (h + m);
        return new CacheStats(config.enabled(), entries.size(), h, m, hitRate, evictions.get(),
                config.similarityThreshold(), embeddings.name());
    }

    /** Hit count of the entry stored under this prompt, or -1 when absent. */
    public long hitCount(String prompt) {
        Entry entry = entries.get(normalize(prompt));
        return entry != null ? entry.hits.get() : -1;
    }

    public void clear() {
        int size = entries.size();
        entries.clear();
        memo.invalidateAll();
        log.info("Semantic cache cleared ({} entries)", size);
    }

    @Scheduled(fixedDelayString = "${relaygate.cache.cleanup-interval:PT5M}")
    public void evictExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(e -> e.isExpired(now));
        int removed = before - entries.size();
        if (removed > 0) log.debug("Removed {} expired cache entries", removed);
    }

    // ── Internal ───────────────────────────────────────────────────

    private Optional<CacheHit> hit(Entry entry, double similarity, Instant now) {
        entry.touch(now);
        hits.incrementAndGet();
        hitCounter.increment();
        log.debug("Cache hit with similarity {}", String.format(Locale.ROOT, "%.3f", similarity));
        return Optional.of(new CacheHit(entry.response, similarity, entry.prompt));
    }

    private Optional<CacheHit> miss() {
        misses.incrementAndGet();
        missCounter.increment();
        return Optional.empty();
    }

    private float[] embed(String normalized) {
        return memo.get(normalized, embeddings::embed);
    }

    /** Evicts the least recently accessed entry other than {@code keep}; false when there is none. */
    private boolean evictLeastRecentlyUsed(String keep) {
        Optional<Entry> oldest = entries.values().stream()
                .filter(e -> !e.key.equals(keep))
                .min(Comparator.comparingLong(Entry::lastAccessedMillis));
        oldest.ifPresent(e -> {
            if (entries.remove(e.key, e)) evictions.incrementAndGet();
        });
        return oldest.isPresent();
    }

    static String normalize(String prompt) {
        return prompt.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    static double cosine(float[] a, float[] b) {
        if (a.length != b.length) return 0.0;
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        double magnitude = Math.sqrt(normA) * Math.sqrt(normB);
        return magnitude == 0 ? 0.0 : dot / magnitude;
    }

    private final class Entry {
        final String key;
        final String prompt;
        final float[] embedding;
        final ProviderResponse response;
        final Instant storedAt;
        final AtomicLong hits = new AtomicLong();
        volatile long lastAccessed;

        Entry(String key, String prompt, float[] embedding, ProviderResponse response, Instant storedAt) {
            this.key = key;
            this.prompt = prompt;
            this.embedding = embedding;
            this.response = response;
            this.storedAt = storedAt;
            this.lastAccessed = storedAt.toEpochMilli();
        }

        boolean isExpired(Instant now) {
            return !storedAt.plus(config.ttl()).isAfter(now);
        }

        void touch(Instant now) {
            hits.incrementAndGet();
            lastAccessed = now.toEpochMilli();
        }

        long lastAccessedMillis() {
            return lastAccessed;
        }
    }
}
