package dev.relaygate.cache;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Offline feature-hashed embedding: word tokens and character trigrams are hashed
 * into a fixed number of signed buckets, then L2-normalized. Shared vocabulary and
 * spelling drive similarity; meaning does not.
 */
@Component
@ConditionalOnProperty(prefix = "relaygate.cache", name = "embedding", havingValue = "hashing", matchIfMissing = true)
public class HashingEmbeddingProvider implements EmbeddingProvider {

    public static final int DIMENSIONS = 384;
    private static final float WORD_WEIGHT = 1.0f;
    private static final float TRIGRAM_WEIGHT = 0.5f;

    @Override
    public float[] embed(String text) {
        float[] vector = new float[DIMENSIONS];
        if (text == null) return vector;
        String[] words = text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+");
        for (String word : words) {
            if (word.isEmpty()) continue;
            add(vector, "w:" + word, WORD_WEIGHT);
            String padded = "^" + word + "$";
            for (int i = 0; i + 3 <= padded.length(); i++) {
                add(vector, "t:" + padded.substring(i, i + 3), TRIGRAM_WEIGHT);
            }
        }
        normalize(vector);
        return vector;
    }

    @Override
    public String name() {
        return "hashing";
    }

    // ── Internal ───────────────────────────────────────────────────

    private static void add(float[] vector, String feature, float weight) {
        int hash = fnv1a(feature.getBytes(StandardCharsets.UTF_8));
        int bucket = Math.floorMod(hash, DIMENSIONS);
        // high bit picks the sign so colliding features tend to cancel
        vector[bucket] += (hash >>> 31) == 0 ? weight : -weight;
    }

    private static int fnv1a(byte[] bytes) {
        int hash = 0x811c9dc5;
        for (byte b : bytes) {
            hash ^= b & 0xff;
            hash *= 0x01000193;
        }
        return hash;
    }

    private static void normalize(float[] vector) {
        double norm = 0;
        for (float v : vector) norm += v * v;
        if (norm == 0) return;
        float scale = (float) (1.0 / Math.sqrt(norm));
        for (int i = 0; i < vector.length; i++) vector[i] *= scale;
    }
}
