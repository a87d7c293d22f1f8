package eu.virtualparadox.regreader.rag.index;

import eu.virtualparadox.regreader.core.exception.IndexException;
import eu.virtualparadox.regreader.storage.model.BlockType;
import eu.virtualparadox.regreader.storage.model.SearchResult;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.search.WildcardQuery;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import static eu.virtualparadox.regreader.util.LuceneConstants.*;

/**
 * Shared field layout, filtering and lifecycle of the Lucene backends.
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code uid}: {@code regId/blockId}, the upsert key</li>
 *   <li>{@code regId}, {@code blockId}, {@code blockType}, {@code sectionNumber}, {@code tableId}:
 *       stored keyword fields, filterable</li>
 *   <li>{@code chapterPath}: the path joined with {@code " > "}, filterable by substring</li>
 *   <li>{@code pageNum}: stored only</li>
 * </ul>
 * Subclasses add the searchable representation of the content.
 */
abstract class LuceneBlockIndex implements BlockIndex, Closeable {

    protected final LuceneIndexResources resources;

    protected LuceneBlockIndex(final LuceneIndexResources resources) {
        this.resources = resources;
    }

    /**
     * Converts a batch of blocks into Lucene documents.
     *
     * @return block uid to document; blocks the backend skips are absent
     */
    protected abstract Map<String, Document> toDocuments(List<IndexedBlock> blocks);

    /**
     * Runs the backend-specific query.
     *
     * @param searcher acquired searcher
     * @param query    search request
     * @param filter   metadata filter, {@code null} when the request has none
     * @return top hits, best first
     */
    protected abstract TopDocs execute(IndexSearcher searcher, SearchQuery query, Query filter) throws IOException;

    /**
     * @return snippet shown for a hit
     */
    protected abstract String snippet(Document doc, SearchQuery query);

    @Override
    public void indexBlocks(final List<IndexedBlock> blocks) {
        if (blocks == null) {
            throw new IllegalArgumentException("blocks must not be null");
        }
        final IndexWriter writer = resources.getWriter();
        try {
            for (final Map.Entry<String, Document> doc : toDocuments(blocks).entrySet()) {
                writer.updateDocument(new Term(FIELD_UID, doc.getKey()), doc.getValue());
            }
            writer.commit();
            resources.getSearcherManager().maybeRefreshBlocking();
        } catch (final IOException | IllegalArgumentException e) {
            throw new IndexException(name(), "Unable to index " + blocks.size() + " blocks", e);
        }
    }

    @Override
    public List<SearchResult> search(final SearchQuery query) {
        final SearcherManager searcherManager = resources.getSearcherManager();
        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                final TopDocs topDocs = execute(searcher, query, buildFilter(query));
                final List<SearchResult> results = new ArrayList<>(topDocs.scoreDocs.length);
                for (final ScoreDoc sd : topDocs.scoreDocs) {
                    final Document doc = searcher.storedFields().document(sd.doc);
                    results.add(toSearchResult(doc, sd.score, query));
                }
                return results;
            } finally {
                searcherManager.release(searcher);
            }
        } catch (final IOException e) {
            throw new IndexException(name(), "Search failed for query: " + query.query(), e);
        }
    }

    @Override
    public void deleteCollection(final String regId) {
        if (regId == null || regId.isBlank()) {
            throw new IllegalArgumentException("regId must not be blank");
        }
        try {
            resources.getWriter().deleteDocuments(new Term(FIELD_REG_ID, regId));
            resources.getWriter().commit();
            resources.getSearcherManager().maybeRefreshBlocking();
        } catch (final IOException e) {
            throw new IndexException(name(), "Unable to delete collection " + regId, e);
        }
    }

    @Override
    public void close() {
        resources.close();
    }

    /**
     * Creates a document with the metadata fields shared by all backends.
     */
    protected Document baseDocument(final IndexedBlock block) {
        final Document d = new Document();

        // Identifiers
        d.add(new StringField(FIELD_UID, block.uid(), Field.Store.YES));
        d.add(new StringField(FIELD_REG_ID, block.regId(), Field.Store.YES));
        d.add(new StringField(FIELD_BLOCK_ID, block.block().blockId(), Field.Store.YES));
        d.add(new StringField(FIELD_BLOCK_TYPE, typeName(block.block().blockType()), Field.Store.YES));
        d.add(new StoredField(FIELD_PAGE_NUM, block.pageNum()));

        // Chapter and table metadata
        d.add(new StringField(FIELD_CHAPTER_PATH, String.join(CHAPTER_PATH_SEPARATOR, block.chapterPath()), Field.Store.YES));
        if (block.sectionNumber() != null) {
            d.add(new StringField(FIELD_SECTION_NUMBER, block.sectionNumber(), Field.Store.YES));
        }
        if (block.tableId() != null) {
            d.add(new StringField(FIELD_TABLE_ID, block.tableId(), Field.Store.YES));
        }
        return d;
    }

    /**
     * @return conjunction of the request's filters, {@code null} if it has none
     */
    protected Query buildFilter(final SearchQuery query) {
        final BooleanQuery.Builder filter = new BooleanQuery.Builder();
        boolean any = false;

        if (query.regId() != null) {
            filter.add(new TermQuery(new Term(FIELD_REG_ID, query.regId())), BooleanClause.Occur.FILTER);
            any = true;
        }
        if (query.chapterScope() != null && !query.chapterScope().isBlank()) {
            final String pattern = "*" + escapeWildcard(query.chapterScope().strip()) + "*";
            filter.add(new WildcardQuery(new Term(FIELD_CHAPTER_PATH, pattern)), BooleanClause.Occur.FILTER);
            any = true;
        }
        if (!query.blockTypes().isEmpty()) {
            final BooleanQuery.Builder types = new BooleanQuery.Builder();
            for (final BlockType type : query.blockTypes()) {
                types.add(new TermQuery(new Term(FIELD_BLOCK_TYPE, typeName(type))), BooleanClause.Occur.SHOULD);
            }
            types.setMinimumNumberShouldMatch(1);
            filter.add(types.build(), BooleanClause.Occur.FILTER);
            any = true;
        }
        if (query.sectionNumber() != null) {
            filter.add(new TermQuery(new Term(FIELD_SECTION_NUMBER, query.sectionNumber())), BooleanClause.Occur.FILTER);
            any = true;
        }
        return any ? filter.build() : null;
    }

    private SearchResult toSearchResult(final Document doc, final float score, final SearchQuery query) {
        final String path = doc.get(FIELD_CHAPTER_PATH);
        final List<String> chapterPath = path == null || path.isEmpty()
                ? List.of()
                : Arrays.asList(path.split(Pattern.quote(CHAPTER_PATH_SEPARATOR)));
        return new SearchResult(
                doc.get(FIELD_REG_ID),
                doc.getField(FIELD_PAGE_NUM).numericValue().intValue(),
                chapterPath,
                doc.get(FIELD_BLOCK_ID),
                snippet(doc, query),
                score);
    }

    private static String typeName(final BlockType type) {
        return type.name().toLowerCase(Locale.ROOT);
    }

    private static String escapeWildcard(final String text) {
        final StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c == '*' || c == '?' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
