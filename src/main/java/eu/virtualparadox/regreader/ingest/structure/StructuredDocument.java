package eu.virtualparadox.regreader.ingest.structure;

import eu.virtualparadox.regreader.storage.model.DocumentStructure;
import eu.virtualparadox.regreader.storage.model.PageDocument;

import java.util.List;

/**
 * Output of {@link DocumentStructureBuilder}: the chapter tree and the pages with every block
 * linked to its chapter.
 */
public record StructuredDocument(DocumentStructure structure, List<PageDocument> pages) {

    public StructuredDocument {
        pages = List.copyOf(pages);
    }
}
