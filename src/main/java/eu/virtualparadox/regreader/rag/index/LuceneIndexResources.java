package eu.virtualparadox.regreader.rag.index;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Directory, analyzer, writer and searcher manager of one Lucene index, opened together and
 * closed together.
 */
@Getter
@Slf4j
public final class LuceneIndexResources implements Closeable {

    private final Directory directory;
    private final Analyzer analyzer;
    private final IndexWriter writer;
    private final SearcherManager searcherManager;

    private LuceneIndexResources(final Directory directory,
                                 final Analyzer analyzer,
                                 final IndexWriter writer,
                                 final SearcherManager searcherManager) {
        this.directory = directory;
        this.analyzer = analyzer;
        this.writer = writer;
        this.searcherManager = searcherManager;
    }

    /**
     * Opens an on-disk index in create-or-append mode.
     *
     * @param path     index directory, created if missing
     * @param analyzer analyzer for indexing and query parsing
     * @return opened resources
     * @throws IOException if the index cannot be opened
     */
    public static LuceneIndexResources open(final Path path, final Analyzer analyzer) throws IOException {
        Files.createDirectories(path);
        return open(FSDirectory.open(path), analyzer);
    }

    /**
     * Opens an index over an existing directory, e.g. an in-memory one.
     */
    public static LuceneIndexResources open(final Directory directory, final Analyzer analyzer) throws IOException {
        final IndexWriterConfig cfg = new IndexWriterConfig(analyzer)
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        final IndexWriter writer = new IndexWriter(directory, cfg);
        final SearcherManager searcherManager = new SearcherManager(writer, null);
        return new LuceneIndexResources(directory, analyzer, writer, searcherManager);
    }

    @Override
    public void close() {
        try { searcherManager.close(); } catch (Exception e) {
            log.error("Unable to close SearcherManager", e);
        }

        try { writer.close(); } catch (Exception e) {
            log.error("Unable to close IndexWriter", e);
        }

        try { analyzer.close(); } catch (Exception e) {
            log.error("Unable to close Analyzer", e);
        }

        try { directory.close(); } catch (Exception e) {
            log.error("Unable to close Directory", e);
        }
    }
}
