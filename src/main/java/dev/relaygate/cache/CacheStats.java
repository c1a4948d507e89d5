package dev.relaygate.cache;

public record CacheStats(boolean enabled, int size, long hits, long misses, double hitRate, long evictions,
                         double similarityThreshold, String embedding) {
}
