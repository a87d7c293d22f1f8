package eu.virtualparadox.regreader.rag.index;

import eu.virtualparadox.regreader.application.config.ApplicationConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.TextField;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.queryparser.classic.QueryParserBase;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TopDocs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static eu.virtualparadox.regreader.util.LuceneConstants.FIELD_TEXT;

/**
 * BM25 keyword backend.
 * <p>
 * The full block content is indexed as a {@link TextField}; the query text is escaped and
 * parsed with the classic {@link QueryParser}, so operators typed by a user are taken
 * literally. Snippets are cut around the earliest occurrence of a query term.
 */
@Slf4j
public final class LuceneKeywordIndex extends LuceneBlockIndex implements KeywordIndex {

    static final String NAME = "lucene-bm25";

    private final int snippetLength;

    public LuceneKeywordIndex(final LuceneIndexResources resources, final ApplicationConfig.Index config) {
        super(resources);
        this.snippetLength = config.getSnippetLength();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected Map<String, Document> toDocuments(final List<IndexedBlock> blocks) {
        final Map<String, Document> docs = new LinkedHashMap<>();
        for (final IndexedBlock block : blocks) {
            final String content = block.block().content();
            if (StringUtils.isBlank(content)) {
                continue;
            }
            final Document d = baseDocument(block);
            d.add(new TextField(FIELD_TEXT, content, Field.Store.YES));
            docs.put(block.uid(), d);
        }
        return docs;
    }

    @Override
    protected TopDocs execute(final IndexSearcher searcher, final SearchQuery query, final Query filter) throws IOException {
        final BooleanQuery.Builder bq = new BooleanQuery.Builder()
                .add(parse(query.query()), BooleanClause.Occur.MUST);
        if (filter != null) {
            bq.add(filter, BooleanClause.Occur.FILTER);
        }
        final TopDocs topDocs = searcher.search(bq.build(), query.limit());
        log.debug("[{}] '{}' matched {} blocks", NAME, query.query(), topDocs.scoreDocs.length);
        return topDocs;
    }

    @Override
    protected String snippet(final Document doc, final SearchQuery query) {
        final String text = doc.get(FIELD_TEXT);
        if (text == null) {
            return "";
        }
        if (text.length() <= snippetLength) {
            return text;
        }
        final String lower = text.toLowerCase(Locale.ROOT);
        int hit = -1;
        for (final String term : terms(query.query())) {
            final int pos = lower.indexOf(term);
            if (pos >= 0 && (hit < 0 || pos < hit)) {
                hit = pos;
            }
        }
        final int start = hit < 0 ? 0 : Math.max(0, Math.min(hit - snippetLength / 4, text.length() - snippetLength));
        final int end = Math.min(text.length(), start + snippetLength);
        return (start > 0 ? "..." : "") + text.substring(start, end) + (end < text.length() ? "..." : "");
    }

    /**
     * Text the analyzer reduces to nothing parses to an empty query that matches no block.
     */
    private Query parse(final String text) {
        final QueryParser parser = new QueryParser(FIELD_TEXT, resources.getAnalyzer());
        try {
            return parser.parse(QueryParserBase.escape(text));
        } catch (final ParseException e) {
            throw new IllegalArgumentException("Unparseable keyword query: " + text, e);
        }
    }

    private List<String> terms(final String text) {
        final Analyzer analyzer = resources.getAnalyzer();
        final List<String> terms = new ArrayList<>();
        try (TokenStream ts = analyzer.tokenStream(FIELD_TEXT, text)) {
            final CharTermAttribute term = ts.addAttribute(CharTermAttribute.class);
            ts.reset();
            while (ts.incrementToken()) {
                terms.add(term.toString());
            }
            ts.end();
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
        return terms;
    }
}
