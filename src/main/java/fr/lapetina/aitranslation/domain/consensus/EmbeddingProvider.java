package fr.lapetina.aitranslation.domain.consensus;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns text into vectors for similarity scoring.
 *
 * Implementations throw {@link fr.lapetina.aitranslation.domain.exception.EmbeddingException}
 * when they cannot produce vectors.
 */
public interface EmbeddingProvider {

    float[] embed(String text);

    /**
     * Embeds several texts, preserving order. Override when the backend supports batching.
     */
    default List<float[]> embedAll(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }
}
