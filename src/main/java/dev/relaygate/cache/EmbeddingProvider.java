package dev.relaygate.cache;

/** Turns a prompt into a vector for similarity matching. Implementations must be deterministic. */
public interface EmbeddingProvider {

    float[] embed(String text);

    String name();
}
