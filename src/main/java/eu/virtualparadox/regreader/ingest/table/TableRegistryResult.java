package eu.virtualparadox.regreader.ingest.table;

import eu.virtualparadox.regreader.storage.model.PageDocument;
import eu.virtualparadox.regreader.storage.model.TableRegistry;

import java.util.List;

/**
 * Registry plus the pages whose table blocks now carry master ids and segment indexes.
 */
public record TableRegistryResult(TableRegistry registry, List<PageDocument> pages) {

    public TableRegistryResult {
        pages = List.copyOf(pages);
    }
}
