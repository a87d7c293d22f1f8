package eu.virtualparadox.regreader.rag.index;

import eu.virtualparadox.regreader.application.config.ApplicationConfig;
import eu.virtualparadox.regreader.rag.embed.EmbeddingService;
import eu.virtualparadox.regreader.storage.model.ContentBlock;
import org.apache.lucene.analysis.cjk.CJKAnalyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.store.ByteBuffersDirectory;

import java.io.IOException;
import java.util.List;

import static eu.virtualparadox.regreader.TestPages.REG_ID;
import static eu.virtualparadox.regreader.TestPages.table;
import static eu.virtualparadox.regreader.TestPages.text;

/**
 * In-memory backends and a small shared corpus.
 */
public final class IndexFixtures {

    public static final List<String> DEVICE_PATH = List.of("1 总则", "1.2 设备管理");

    private IndexFixtures() {
    }

    public static LuceneKeywordIndex keywordIndex() throws IOException {
        return new LuceneKeywordIndex(
                LuceneIndexResources.open(new ByteBuffersDirectory(), new CJKAnalyzer()),
                new ApplicationConfig.Index());
    }

    public static LuceneVectorIndex vectorIndex(final EmbeddingService embeddingService,
                                                final ApplicationConfig.Index config) throws IOException {
        return new LuceneVectorIndex(
                LuceneIndexResources.open(new ByteBuffersDirectory(), new StandardAnalyzer()),
                embeddingService, config);
    }

    public static List<IndexedBlock> corpus() {
        final ContentBlock transformer = text("b1", "变压器过载运行时值班人员应立即汇报调度");
        final ContentBlock busbar = text("b2", "母线停电操作前应落实各项安全措施");
        final ContentBlock limits = table("t1", "表1 变压器限值", "| 设备 | 限值 |\n|---|---|\n| 变压器 | 100 |", false);
        final ContentBlock shortText = text("b4", "见下表");
        return List.of(
                new IndexedBlock(REG_ID, 3, transformer, DEVICE_PATH, null, "1.2"),
                new IndexedBlock(REG_ID, 5, busbar, List.of("2 运行管理"), null, "2"),
                new IndexedBlock(REG_ID, 4, limits, DEVICE_PATH, "t1", "1.2"),
                new IndexedBlock(REG_ID, 4, shortText, DEVICE_PATH, null, "1.2"),
                new IndexedBlock("other_reg", 1, transformer, List.of(), null, null));
    }
}
