package eu.virtualparadox.regreader.ingest.table;

import eu.virtualparadox.regreader.storage.model.ContentBlock;
import eu.virtualparadox.regreader.storage.model.PageDocument;
import eu.virtualparadox.regreader.storage.model.TableEntry;
import eu.virtualparadox.regreader.storage.model.TableMeta;
import eu.virtualparadox.regreader.storage.model.TableRegistry;
import eu.virtualparadox.regreader.storage.model.TableSegment;
import eu.virtualparadox.regreader.util.MarkdownTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups table blocks into logical tables and builds the lookup maps of a {@link TableRegistry}.
 * <p>
 * A table block flagged truncated on a page with {@code continuesToNext} opens a logical table.
 * On the next page, when {@code continuesFromPrev} is set, the first table block extends it with
 * the next segment index; if that block is itself truncated and its page continues, the table
 * stays open. Every other table block is a logical table of its own.
 */
@Service
@Slf4j
public class TableRegistryBuilder {

    /**
     * @param regId collection id
     * @param pages all pages in ascending order
     * @return registry and the pages with segment links set on their table blocks
     */
    public TableRegistryResult build(final String regId, final List<PageDocument> pages) {
        final Map<String, TableEntry> tables = new LinkedHashMap<>();
        final Map<String, String> segmentToTable = new LinkedHashMap<>();
        final Map<Integer, List<String>> pageToTables = new LinkedHashMap<>();
        final List<PageDocument> linkedPages = new ArrayList<>(pages.size());

        final Registrar registrar = new Registrar(tables, segmentToTable, pageToTables);
        OpenTable open = null;
        int previousPage = -1;

        for (final PageDocument page : pages) {
            final List<ContentBlock> blocks = page.contentBlocks();
            final boolean adjacent = page.pageNum() == previousPage + 1;
            final int continuationIdx = open != null && adjacent && page.continuesFromPrev()
                    ? firstTableIndex(blocks)
                    : -1;

            if (open != null && continuationIdx < 0) {
                log.warn("Table {} of {} is flagged to continue but P{} has no continuation",
                        open.masterId, regId, page.pageNum());
                registrar.register(open);
                open = null;
            }

            final int openIdx = page.continuesToNext() ? lastTruncatedTableIndex(blocks) : -1;
            final List<ContentBlock> linkedBlocks = new ArrayList<>(blocks.size());

            for (int i = 0; i < blocks.size(); i++) {
                final ContentBlock block = blocks.get(i);
                if (!block.tableBlock()) {
                    linkedBlocks.add(block);
                    continue;
                }

                if (i == continuationIdx) {
                    final ContentBlock linked = withSegment(block, open.masterId, open.segments.size());
                    open.add(page.pageNum(), linked);
                    linkedBlocks.add(linked);
                    if (i != openIdx) {
                        registrar.register(open);
                        open = null;
                    }
                    continue;
                }

                final String masterId = registrar.uniqueId(segmentId(block), block.blockId());
                final ContentBlock linked = withSegment(block, null, 0);
                final OpenTable table = new OpenTable(masterId, page.pageNum(), linked);
                linkedBlocks.add(linked);
                if (i == openIdx) {
                    open = table;
                } else {
                    registrar.register(table);
                }
            }

            linkedPages.add(page.toBuilder().contentBlocks(linkedBlocks).build());
            previousPage = page.pageNum();
        }

        if (open != null) {
            log.warn("Table {} of {} is still open after the last page", open.masterId, regId);
            registrar.register(open);
        }

        final int crossPage = (int) tables.values().stream().filter(TableEntry::crossPage).count();
        log.info("Registered {} tables of {} ({} cross-page)", tables.size(), regId, crossPage);

        final TableRegistry registry = new TableRegistry(regId, TableRegistry.CURRENT_VERSION,
                tables, segmentToTable, pageToTables, tables.size(), crossPage);
        return new TableRegistryResult(registry, linkedPages);
    }

    private static ContentBlock withSegment(final ContentBlock block, final String masterId, final int segmentIndex) {
        final TableMeta meta = block.tableMeta() != null
                ? block.tableMeta()
                : TableMeta.builder().tableId(block.blockId()).build();
        return block.toBuilder()
                .tableMeta(meta.toBuilder().masterTableId(masterId).segmentIndex(segmentIndex).build())
                .build();
    }

    private static String segmentId(final ContentBlock block) {
        final TableMeta meta = block.tableMeta();
        return meta != null && meta.tableId() != null && !meta.tableId().isBlank()
                ? meta.tableId()
                : block.blockId();
    }

    private static int firstTableIndex(final List<ContentBlock> blocks) {
        for (int i = 0; i < blocks.size(); i++) {
            if (blocks.get(i).tableBlock()) {
                return i;
            }
        }
        return -1;
    }

    private static int lastTruncatedTableIndex(final List<ContentBlock> blocks) {
        for (int i = blocks.size() - 1; i >= 0; i--) {
            final ContentBlock block = blocks.get(i);
            if (block.tableBlock() && block.tableMeta() != null && block.tableMeta().truncated()) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Segments collected for one logical table.
     */
    private static final class OpenTable {
        private final String masterId;
        private final List<Integer> pageNums = new ArrayList<>();
        private final List<ContentBlock> segments = new ArrayList<>();

        private OpenTable(final String masterId, final int pageNum, final ContentBlock first) {
            this.masterId = masterId;
            add(pageNum, first);
        }

        private void add(final int pageNum, final ContentBlock segment) {
            pageNums.add(pageNum);
            segments.add(segment);
        }
    }

    /**
     * Turns finished tables into registry entries and keeps the reverse indexes in step.
     */
    private static final class Registrar {
        private final Map<String, TableEntry> tables;
        private final Map<String, String> segmentToTable;
        private final Map<Integer, List<String>> pageToTables;

        private Registrar(final Map<String, TableEntry> tables,
                          final Map<String, String> segmentToTable,
                          final Map<Integer, List<String>> pageToTables) {
            this.tables = tables;
            this.segmentToTable = segmentToTable;
            this.pageToTables = pageToTables;
        }

        /**
         * @return {@code preferred} unless another table already uses it
         */
        private String uniqueId(final String preferred, final String fallback) {
            if (!segmentToTable.containsKey(preferred)) {
                return preferred;
            }
            log.warn("Duplicate table id {}, using block id {}", preferred, fallback);
            return fallback;
        }

        private void register(final OpenTable table) {
            final ContentBlock first = table.segments.get(0);
            final List<String> markdown = table.segments.stream().map(ContentBlock::content).toList();

            final List<TableSegment> segments = new ArrayList<>();
            int rowStart = 0;
            for (int i = 0; i < table.segments.size(); i++) {
                final ContentBlock segment = table.segments.get(i);
                final int rows = MarkdownTable.dataRows(segment.content()).size();
                final String id = i == 0 ? table.masterId : segmentId(segment);
                segments.add(new TableSegment(id, table.pageNums.get(i), segment.blockId(), i, rowStart, rowStart + rows));
                rowStart += rows;

                segmentToTable.putIfAbsent(id, table.masterId);
                segmentToTable.putIfAbsent(segment.blockId(), table.masterId);
                final List<String> onPage = pageToTables.computeIfAbsent(table.pageNums.get(i), p -> new ArrayList<>());
                if (!onPage.contains(table.masterId)) {
                    onPage.add(table.masterId);
                }
            }

            final TableMeta meta = first.tableMeta();
            final List<String> headerRows = MarkdownTable.headerRows(first.content());
            final List<String> colHeaders = !meta.colHeaders().isEmpty() || headerRows.isEmpty()
                    ? meta.colHeaders()
                    : MarkdownTable.cells(headerRows.get(0));
            final int colCount = meta.colCount() > 0 ? meta.colCount() : colHeaders.size();

            tables.put(table.masterId, new TableEntry(
                    table.masterId,
                    meta.caption(),
                    first.chapterPath(),
                    table.pageNums.get(0),
                    table.pageNums.get(table.pageNums.size() - 1),
                    table.segments.size() > 1,
                    segments,
                    rowStart,
                    colCount,
                    colHeaders,
                    MarkdownTable.stitch(markdown)));
        }
    }
}
