package eu.virtualparadox.regreader.ingest;

import eu.virtualparadox.regreader.storage.model.PageDocument;

import java.util.List;

/**
 * Parsed pages of one regulation, ready to be stored and indexed.
 *
 * @param regId      collection id
 * @param title      human readable title
 * @param sourceFile file the pages were parsed from, may be {@code null}
 * @param pages      pages numbered from 1 without gaps
 */
public record IngestionRequest(String regId, String title, String sourceFile, List<PageDocument> pages) {

    public IngestionRequest {
        if (regId == null || regId.isBlank()) {
            throw new IllegalArgumentException("regId must not be blank");
        }
        title = title == null || title.isBlank() ? regId : title;
        pages = pages == null ? List.of() : List.copyOf(pages);
    }
}
