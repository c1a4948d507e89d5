package dev.relaygate.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HashingEmbeddingProviderTest {

    private final HashingEmbeddingProvider provider = new HashingEmbeddingProvider();

    @Test
    @DisplayName("vectors are deterministic and unit length")
    void deterministicUnitVectors() {
        float[] first = provider.embed("explain the visitor pattern");
        float[] second = provider.embed("explain the visitor pattern");

        assertThat(first).hasSize(HashingEmbeddingProvider.DIMENSIONS).containsExactly(second);
        assertThat(SemanticCache.cosine(first, second)).isCloseTo(1.0, within(1e-6));
        double norm = 0;
        for (float v : first) norm += v * v;
        assertThat(Math.sqrt(norm)).isCloseTo(1.0, within(1e-5));
    }

    @Test
    @DisplayName("shared wording scores higher than unrelated text")
    void sharedWordingIsCloser() {
        float[] base = provider.embed("how do I sort a list in java");
        float[] paraphrase = provider.embed("how do I sort a list in java quickly");
        float[] unrelated = provider.embed("weather forecast for tomorrow afternoon");

        assertThat(SemanticCache.cosine(base, paraphrase))
                .isGreaterThan(SemanticCache.cosine(base, unrelated));
    }

    @Test
    @DisplayName("text without word characters embeds to the zero vector")
    void emptyText() {
        float[] vector = provider.embed("   ?!  ");

        assertThat(vector).containsOnly(0f);
        assertThat(SemanticCache.cosine(vector, provider.embed("hello"))).isZero();
    }
}
