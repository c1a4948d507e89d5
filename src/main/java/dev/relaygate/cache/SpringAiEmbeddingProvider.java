package dev.relaygate.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Embeddings from a Spring AI {@link EmbeddingModel}, selected by bean name
 * ({@code relaygate.cache.embedding-model}).
 */
@Component
@ConditionalOnProperty(prefix = "relaygate.cache", name = "embedding", havingValue = "model")
public class SpringAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbeddingProvider.class);

    private final EmbeddingModel model;
    private final String beanName;

    public SpringAiEmbeddingProvider(Map<String, EmbeddingModel> models,
                                     @Value("${relaygate.cache.embedding-model:openAiEmbeddingModel}") String beanName) {
        this.model = models.get(beanName);
        if (model == null) {
            throw new IllegalStateException("No EmbeddingModel bean named '%s'; available: %s"
                    .formatted(beanName, models.keySet()));
        }
        this.beanName = beanName;
        log.info("Semantic cache embeddings from {}", beanName);
    }

    @Override
    public float[] embed(String text) {
        return model.embed(text);
    }

    @Override
    public String name() {
        return beanName;
    }
}
