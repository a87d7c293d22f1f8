package eu.virtualparadox.regreader.ingest;

/**
 * Summary of a completed ingestion.
 *
 * @param regId           collection id
 * @param pages           pages stored
 * @param chapters        chapter nodes built
 * @param tables          logical tables registered
 * @param crossPageTables tables spanning more than one page
 * @param indexedBlocks   blocks offered to the search backends
 */
public record IngestionResult(String regId,
                              int pages,
                              int chapters,
                              int tables,
                              int crossPageTables,
                              int indexedBlocks) {
}
