package eu.virtualparadox.regreader.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.regreader.application.config.ApplicationConfig;
import eu.virtualparadox.regreader.core.exception.InvalidPageRangeException;
import eu.virtualparadox.regreader.core.exception.PageNotFoundException;
import eu.virtualparadox.regreader.core.exception.RegulationNotFoundException;
import eu.virtualparadox.regreader.core.exception.StorageException;
import eu.virtualparadox.regreader.core.exception.TableNotFoundException;
import eu.virtualparadox.regreader.storage.model.DocumentStructure;
import eu.virtualparadox.regreader.storage.model.PageContent;
import eu.virtualparadox.regreader.storage.model.PageDocument;
import eu.virtualparadox.regreader.storage.model.RegulationInfo;
import eu.virtualparadox.regreader.storage.model.TableEntry;
import eu.virtualparadox.regreader.storage.model.TableRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * File-backed store of regulation pages and their derived artifacts.
 * <p>
 * Layout under {@code regreader.pages-dir}:
 * <pre>
 * {regId}/page_0001.json
 * {regId}/structure.json
 * {regId}/table_registry.json
 * {regId}/info.json
 * </pre>
 * A page is addressed purely by {@code (regId, pageNum)}. Every file is written to a temporary
 * file in the same directory and moved into place atomically, so concurrent readers never see a
 * partially written artifact.
 */
@Service
@Slf4j
public class PageStore {

    private static final String PAGE_FILE_FORMAT = "page_%04d.json";
    private static final Pattern PAGE_FILE = Pattern.compile("^page_(\\d{4,})\\.json$");
    private static final String INFO_FILE = "info.json";
    private static final String STRUCTURE_FILE = "structure.json";
    private static final String TABLE_REGISTRY_FILE = "table_registry.json";

    /** Temporary file prefix for atomic writes. */
    private static final String TEMP_FILE_PREFIX = ".write-";

    /** Temporary file suffix for atomic writes. */
    private static final String TEMP_FILE_SUFFIX = ".tmp";

    private final Path pagesDir;
    private final int maxPagesPerRange;
    private final ObjectMapper objectMapper;
    private final CrossPageTableMerger tableMerger = new CrossPageTableMerger();

    public PageStore(final ApplicationConfig config, final ObjectMapper objectMapper) {
        if (config.getPagesDir() == null) {
            throw new IllegalArgumentException("regreader.pages-dir must be configured");
        }
        if (config.getPageRange().getMaxPages() < 1) {
            throw new IllegalArgumentException("regreader.page-range.max-pages must be >= 1");
        }
        this.pagesDir = config.getPagesDir();
        this.maxPagesPerRange = config.getPageRange().getMaxPages();
        this.objectMapper = objectMapper;
    }

    /**
     * Persists a single page, replacing any previous version.
     *
     * @param page page to store
     */
    public void savePage(final PageDocument page) {
        writeAtomically(pagePath(page.regId(), page.pageNum()), page);
    }

    /**
     * Persists every page of a regulation together with its structure, table registry and
     * descriptive record.
     *
     * @param regId      collection id
     * @param pages      all pages of the regulation
     * @param structure  chapter tree built from the pages
     * @param registry   table registry built from the pages
     * @param title      human readable title
     * @param sourceFile file the pages were parsed from
     * @return the stored descriptive record
     */
    public RegulationInfo savePages(final String regId,
                                    final List<PageDocument> pages,
                                    final DocumentStructure structure,
                                    final TableRegistry registry,
                                    final String title,
                                    final String sourceFile) {
        for (final PageDocument page : pages) {
            if (!regId.equals(page.regId())) {
                throw new IllegalArgumentException("Page P" + page.pageNum() + " belongs to "
                        + page.regId() + ", not " + regId);
            }
            savePage(page);
        }
        saveDocumentStructure(structure);
        saveTableRegistry(registry);

        final RegulationInfo info = new RegulationInfo(regId, title, sourceFile, pages.size(), Instant.now());
        writeAtomically(collectionDir(regId).resolve(INFO_FILE), info);

        log.info("Stored {} pages of {} under {}", pages.size(), regId, collectionDir(regId));
        return info;
    }

    /**
     * @throws RegulationNotFoundException if the collection does not exist
     * @throws PageNotFoundException       if the collection exists but the page was never stored
     */
    public PageDocument loadPage(final String regId, final int pageNum) {
        requireCollection(regId);
        final Path path = pagePath(regId, pageNum);
        if (!Files.isRegularFile(path)) {
            throw new PageNotFoundException(regId, pageNum);
        }
        return read(path, PageDocument.class);
    }

    /**
     * Loads {@code start..end} and merges the pages into one markdown document with cross-page
     * tables stitched. The span is capped at {@code regreader.page-range.max-pages}; pages
     * missing inside the range are skipped.
     *
     * @throws InvalidPageRangeException   if {@code start < 1} or {@code start > end}
     * @throws RegulationNotFoundException if the collection does not exist
     * @throws PageNotFoundException       if no page of the range exists
     */
    public PageContent loadPageRange(final String regId, final int start, final int end) {
        if (start < 1 || start > end) {
            throw new InvalidPageRangeException(start, end);
        }
        requireCollection(regId);

        final int cappedEnd = (int) Math.min((long) end, (long) start + maxPagesPerRange - 1);
        if (cappedEnd < end) {
            log.info("Page range {} P{}-P{} capped to P{}-P{}", regId, start, end, start, cappedEnd);
        }

        final List<PageDocument> pages = new ArrayList<>();
        for (int pageNum = start; pageNum <= cappedEnd; pageNum++) {
            try {
                pages.add(loadPage(regId, pageNum));
            } catch (final PageNotFoundException e) {
                log.warn("Page {} P{} does not exist, skipping", regId, pageNum);
            }
        }
        if (pages.isEmpty()) {
            throw new PageNotFoundException(regId, start);
        }

        final CrossPageTableMerger.MergedPages merged = tableMerger.merge(pages);
        final PageDocument last = pages.get(pages.size() - 1);
        return new PageContent(regId, start, cappedEnd, merged.markdown(), pages,
                merged.hasMergedTables(), last.continuesToNext());
    }

    /**
     * @return ids of all stored collections, sorted
     */
    public List<String> listCollections() {
        if (!Files.isDirectory(pagesDir)) {
            return List.of();
        }
        try (Stream<Path> dirs = Files.list(pagesDir)) {
            return dirs.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .filter(name -> !name.startsWith("."))
                    .sorted()
                    .toList();
        } catch (final IOException e) {
            throw new StorageException("Unable to list collections under " + pagesDir, e);
        }
    }

    public boolean exists(final String regId) {
        return Files.isDirectory(collectionDir(regId));
    }

    /**
     * Removes every stored artifact of a collection.
     *
     * @return {@code true} if the collection existed
     */
    public boolean deleteCollection(final String regId) {
        final Path dir = collectionDir(regId);
        if (!Files.isDirectory(dir)) {
            return false;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            final List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (final Path path : paths) {
                Files.deleteIfExists(path);
            }
        } catch (final IOException e) {
            throw new StorageException("Unable to delete collection " + regId, e);
        }
        log.info("Deleted stored pages of {}", regId);
        return true;
    }

    /**
     * @return stored page numbers, ascending
     * @throws RegulationNotFoundException if the collection does not exist
     */
    public List<Integer> pageNumbers(final String regId) {
        requireCollection(regId);
        final List<Integer> numbers = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(collectionDir(regId), "page_*.json")) {
            for (final Path file : files) {
                final Matcher m = PAGE_FILE.matcher(file.getFileName().toString());
                if (m.matches()) {
                    numbers.add(Integer.parseInt(m.group(1)));
                }
            }
        } catch (final IOException e) {
            throw new StorageException("Unable to list pages of " + regId, e);
        }
        numbers.sort(Comparator.naturalOrder());
        return numbers;
    }

    /**
     * @throws RegulationNotFoundException if the collection does not exist
     */
    public Optional<RegulationInfo> loadInfo(final String regId) {
        requireCollection(regId);
        return readIfPresent(collectionDir(regId).resolve(INFO_FILE), RegulationInfo.class);
    }

    public void saveDocumentStructure(final DocumentStructure structure) {
        writeAtomically(collectionDir(structure.regId()).resolve(STRUCTURE_FILE), structure);
    }

    /**
     * @throws RegulationNotFoundException if the collection does not exist
     */
    public Optional<DocumentStructure> loadDocumentStructure(final String regId) {
        requireCollection(regId);
        return readIfPresent(collectionDir(regId).resolve(STRUCTURE_FILE), DocumentStructure.class);
    }

    public void saveTableRegistry(final TableRegistry registry) {
        writeAtomically(collectionDir(registry.regId()).resolve(TABLE_REGISTRY_FILE), registry);
    }

    /**
     * @throws RegulationNotFoundException if the collection does not exist
     */
    public Optional<TableRegistry> loadTableRegistry(final String regId) {
        requireCollection(regId);
        return readIfPresent(collectionDir(regId).resolve(TABLE_REGISTRY_FILE), TableRegistry.class);
    }

    /**
     * Looks a table up by its master id or by the id of any of its segments.
     *
     * @throws TableNotFoundException if no table matches
     */
    public TableEntry getTableById(final String regId, final String tableId) {
        return loadTableRegistry(regId)
                .orElseThrow(() -> new TableNotFoundException(regId, tableId))
                .fullTable(tableId);
    }

    public List<TableEntry> getTablesOnPage(final String regId, final int pageNum) {
        return loadTableRegistry(regId)
                .map(registry -> registry.tablesOnPage(pageNum))
                .orElse(List.of());
    }

    private void requireCollection(final String regId) {
        if (!exists(regId)) {
            throw new RegulationNotFoundException(regId);
        }
    }

    private Path pagePath(final String regId, final int pageNum) {
        if (pageNum < 1) {
            throw new PageNotFoundException(regId, pageNum);
        }
        return collectionDir(regId).resolve(String.format(PAGE_FILE_FORMAT, pageNum));
    }

    private Path collectionDir(final String regId) {
        if (regId == null || regId.isBlank()) {
            throw new IllegalArgumentException("regId must not be blank");
        }
        if (regId.startsWith(".") || regId.contains("/") || regId.contains("\\") || regId.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("regId is not a valid collection name: " + regId);
        }
        return pagesDir.resolve(regId);
    }

    private <T> T read(final Path path, final Class<T> type) {
        try {
            return objectMapper.readValue(path.toFile(), type);
        } catch (final IOException e) {
            throw new StorageException("Unable to read " + path, e);
        }
    }

    private <T> Optional<T> readIfPresent(final Path path, final Class<T> type) {
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        return Optional.of(read(path, type));
    }

    private void writeAtomically(final Path target, final Object value) {
        final Path dir = target.getParent();
        Path temp = null;
        try {
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, TEMP_FILE_PREFIX, TEMP_FILE_SUFFIX);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), value);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (final IOException e) {
            final StorageException failure = new StorageException("Unable to write " + target, e);
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (final IOException cleanupEx) {
                    failure.addSuppressed(cleanupEx);
                }
            }
            throw failure;
        }
    }
}
