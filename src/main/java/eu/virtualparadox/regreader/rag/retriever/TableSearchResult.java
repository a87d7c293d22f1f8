package eu.virtualparadox.regreader.rag.retriever;

import eu.virtualparadox.regreader.storage.model.TableEntry;

/**
 * One logical table found by a table search.
 *
 * @param regId   collection the table belongs to
 * @param table   the stitched table, all segments merged
 * @param snippet excerpt of the best matching segment
 * @param score   backend score in single-backend modes, fused score in hybrid mode
 * @param mode    mode that produced the hit
 */
public record TableSearchResult(String regId,
                                TableEntry table,
                                String snippet,
                                double score,
                                TableSearchMode mode) {

    public String tableId() {
        return table.tableId();
    }
}
