package eu.virtualparadox.regreader.rag.embed;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic embedder for tests: character bigrams hashed into a fixed number of buckets,
 * plus a constant bias component so no vector is ever zero.
 */
public class HashingEmbeddingService implements EmbeddingService {

    private final int dimension;

    public HashingEmbeddingService(final int dimension) {
        this.dimension = dimension;
    }

    @Override
    public List<float[]> embedDocuments(final List<String> texts) {
        final List<float[]> vectors = new ArrayList<>(texts.size());
        for (final String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    @Override
    public float[] embedQuery(final String text) {
        return embed(text);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    private float[] embed(final String text) {
        final float[] v = new float[dimension];
        v[0] = 1f;
        final String s = text.strip();
        if (s.length() == 1) {
            v[bucket(s)] += 1f;
        }
        for (int i = 0; i + 1 < s.length(); i++) {
            v[bucket(s.substring(i, i + 2))] += 1f;
        }
        double norm = 0;
        for (final float x : v) {
            norm += x * x;
        }
        final float inv = (float) (1.0 / Math.sqrt(norm));
        for (int i = 0; i < v.length; i++) {
            v[i] *= inv;
        }
        return v;
    }

    private int bucket(final String gram) {
        return 1 + Math.floorMod(gram.hashCode(), dimension - 1);
    }
}
