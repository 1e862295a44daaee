package fr.lapetina.aitranslation.domain.consensus;

import fr.lapetina.aitranslation.domain.exception.EmbeddingException;

import java.util.List;

/**
 * Mean pairwise cosine similarity of a set of texts, clamped to [0, 1].
 */
public final class SemanticAgreement {

    private final EmbeddingProvider embeddingProvider;

    public SemanticAgreement(EmbeddingProvider embeddingProvider) {
        this.embeddingProvider = embeddingProvider;
    }

    /**
     * @return 0 for fewer than two texts
     * @throws EmbeddingException when the embedding provider fails
     */
    public double measure(List<String> texts) {
        if (texts.size() < 2) {
            return 0.0;
        }
        List<float[]> vectors = embeddingProvider.embedAll(texts);
        if (vectors.size() != texts.size()) {
            throw new EmbeddingException("Expected " + texts.size() + " embeddings, got " + vectors.size());
        }

        double sum = 0.0;
        int pairs = 0;
        for (int i = 0; i < vectors.size(); i++) {
            for (int j = i + 1; j < vectors.size(); j++) {
                sum += cosine(vectors.get(i), vectors.get(j));
                pairs++;
            }
        }
        return clamp(sum / pairs);
    }

    /**
     * Cosine similarity; 0 when either vector has no magnitude.
     */
    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new EmbeddingException("Embedding dimensions differ: " + a.length + " vs " + b.length);
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
