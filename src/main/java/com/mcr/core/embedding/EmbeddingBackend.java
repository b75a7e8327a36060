package com.mcr.core.embedding;

/**
 * Text embedding backend. {@link #similarity} is cosine similarity in [-1, 1].
 */
public interface EmbeddingBackend {

    float[] encode(String text);

    default double similarity(float[] a, float[] b) {
        return cosine(a, b);
    }

    static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
