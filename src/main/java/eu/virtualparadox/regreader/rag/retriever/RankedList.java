package eu.virtualparadox.regreader.rag.retriever;

import eu.virtualparadox.regreader.storage.model.SearchResult;

import java.util.List;

/**
 * Results of one backend in its own ranking order.
 *
 * @param source  backend name
 * @param weight  fusion weight of the backend, non-negative
 * @param results hits, best first
 */
public record RankedList(String source, double weight, List<SearchResult> results) {

    public RankedList {
        if (weight < 0 || Double.isNaN(weight)) {
            throw new IllegalArgumentException("weight must be >= 0, got " + weight + " for " + source);
        }
        results = results == null ? List.of() : List.copyOf(results);
    }
}
