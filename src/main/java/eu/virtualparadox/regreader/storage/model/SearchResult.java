package eu.virtualparadox.regreader.storage.model;

import java.util.List;

/**
 * One ranked hit.
 *
 * @param regId       collection the block belongs to
 * @param pageNum     page the block is printed on
 * @param chapterPath chapter titles owning the block
 * @param blockId     source block
 * @param snippet     excerpt of the block content
 * @param score       backend score before fusion, fused score after
 */
public record SearchResult(String regId,
                           int pageNum,
                           List<String> chapterPath,
                           String blockId,
                           String snippet,
                           double score) {

    public SearchResult {
        chapterPath = chapterPath == null ? List.of() : List.copyOf(chapterPath);
    }

    /**
     * @return identity of the source block across backends
     */
    public Key key() {
        return new Key(regId, pageNum, blockId);
    }

    public SearchResult withScore(final double newScore) {
        return new SearchResult(regId, pageNum, chapterPath, blockId, snippet, newScore);
    }

    public record Key(String regId, int pageNum, String blockId) {
    }
}
