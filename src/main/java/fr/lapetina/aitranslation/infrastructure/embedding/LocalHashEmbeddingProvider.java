package fr.lapetina.aitranslation.infrastructure.embedding;

import fr.lapetina.aitranslation.domain.consensus.EmbeddingProvider;
import fr.lapetina.aitranslation.domain.exception.EmbeddingException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Deterministic vectors derived from SHA-256, without any network call.
 *
 * Identical texts always get identical vectors; anything else is close to orthogonal.
 * This measures exact agreement only, it does not capture meaning.
 */
public final class LocalHashEmbeddingProvider implements EmbeddingProvider {

    public static final int DEFAULT_DIMENSION = 768;
    public static final String DEFAULT_SEED = "ai-translation-gateway";

    private static final int CHUNK_SIZE = 64;

    private final int dimension;
    private final byte[] seed;

    public LocalHashEmbeddingProvider() {
        this(DEFAULT_DIMENSION, DEFAULT_SEED);
    }

    public LocalHashEmbeddingProvider(int dimension, String seed) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Embedding dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
        this.seed = (seed != null ? seed : DEFAULT_SEED).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public float[] embed(String text) {
        byte[] input = (text != null ? text : "").getBytes(StandardCharsets.UTF_8);
        float[] vector = new float[dimension];

        int filled = 0;
        int chunk = 0;
        while (filled < dimension) {
            byte[] hash = digest(chunk++, input);
            int count = Math.min(CHUNK_SIZE, dimension - filled);
            for (int i = 0; i < count; i++) {
                int high = hash[i % hash.length] & 0xFF;
                int low = hash[(i + 1) % hash.length] & 0xFF;
                double unit = (high * 256 + low) / 65535.0;
                vector[filled++] = (float) (unit * 2 - 1);
            }
        }
        return vector;
    }

    public int getDimension() {
        return dimension;
    }

    private byte[] digest(int chunk, byte[] input) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            sha256.update(seed);
            sha256.update(Integer.toString(chunk).getBytes(StandardCharsets.UTF_8));
            sha256.update(input);
            return sha256.digest();
        } catch (NoSuchAlgorithmException e) {
            throw new EmbeddingException("SHA-256 not available", e);
        }
    }
}
