package eu.virtualparadox.regreader.storage.model;

import eu.virtualparadox.regreader.core.exception.TableNotFoundException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All logical tables of one regulation with the reverse indexes needed for constant-time
 * lookups. Built once at ingestion and never mutated.
 *
 * @param regId           collection id
 * @param version         artifact format version
 * @param tables          master table id to entry
 * @param segmentToTable  segment id (master ids included) to master table id
 * @param pageToTables    page number to master ids of tables with a segment on that page
 * @param totalTables     number of logical tables
 * @param crossPageTables number of logical tables with more than one segment
 */
public record TableRegistry(String regId,
                            String version,
                            Map<String, TableEntry> tables,
                            Map<String, String> segmentToTable,
                            Map<Integer, List<String>> pageToTables,
                            int totalTables,
                            int crossPageTables) {

    public static final String CURRENT_VERSION = "1.0";

    public TableRegistry {
        tables = tables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tables));
        segmentToTable = segmentToTable == null ? Map.of() : Map.copyOf(segmentToTable);
        final Map<Integer, List<String>> pages = new LinkedHashMap<>();
        if (pageToTables != null) {
            pageToTables.forEach((page, ids) -> pages.put(page, List.copyOf(ids)));
        }
        pageToTables = Collections.unmodifiableMap(pages);
    }

    public static TableRegistry empty(final String regId) {
        return new TableRegistry(regId, CURRENT_VERSION, Map.of(), Map.of(), Map.of(), 0, 0);
    }

    /**
     * Returns the logical table for a master id or any of its segment ids.
     *
     * @throws TableNotFoundException if neither matches
     */
    public TableEntry fullTable(final String tableId) {
        final String masterId = segmentToTable.getOrDefault(tableId, tableId);
        final TableEntry entry = tables.get(masterId);
        if (entry == null) {
            throw new TableNotFoundException(regId, tableId);
        }
        return entry;
    }

    /**
     * @return tables with a segment on {@code pageNum}, empty if none
     */
    public List<TableEntry> tablesOnPage(final int pageNum) {
        return pageToTables.getOrDefault(pageNum, List.of()).stream()
                .map(tables::get)
                .toList();
    }

    public boolean contains(final String tableId) {
        return tables.containsKey(segmentToTable.getOrDefault(tableId, tableId));
    }
}
