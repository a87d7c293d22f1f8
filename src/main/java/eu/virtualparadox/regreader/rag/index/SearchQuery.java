package eu.virtualparadox.regreader.rag.index;

import eu.virtualparadox.regreader.storage.model.BlockType;
import lombok.Builder;

import java.util.Set;

/**
 * Query text plus the optional filters every backend understands.
 *
 * @param query         free text
 * @param regId         restrict to one collection, {@code null} for all
 * @param chapterScope  restrict to blocks whose chapter path contains this text
 * @param blockTypes    restrict to these block types, empty for all
 * @param sectionNumber restrict to blocks owned by exactly this section
 * @param limit         maximum number of results, at least 1
 */
@Builder(toBuilder = true)
public record SearchQuery(String query,
                          String regId,
                          String chapterScope,
                          Set<BlockType> blockTypes,
                          String sectionNumber,
                          int limit) {

    public SearchQuery {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got " + limit);
        }
        blockTypes = blockTypes == null ? Set.of() : Set.copyOf(blockTypes);
    }

    public static SearchQuery of(final String query, final int limit) {
        return new SearchQuery(query, null, null, Set.of(), null, limit);
    }

    public SearchQuery withLimit(final int newLimit) {
        return toBuilder().limit(newLimit).build();
    }
}
