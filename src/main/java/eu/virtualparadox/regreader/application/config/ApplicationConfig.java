package eu.virtualparadox.regreader.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Configuration tree bound from {@code regreader.*}.
 * <p>
 * Components take this object through their constructor and copy out the values they need;
 * nothing reads it statically.
 */
@Configuration
@ConfigurationProperties(prefix = "regreader")
@Getter @Setter
public class ApplicationConfig {

    private Path root;
    private Path pagesDir;
    private Path indexDir;
    private Path modelsDir;

    private Search search = new Search();
    private PageRange pageRange = new PageRange();
    private Structure structure = new Structure();
    private Index index = new Index();
    private Embedding embedding = new Embedding();
    private Ingestion ingestion = new Ingestion();

    @PostConstruct
    public void ensureFolders() throws IOException {
        if (root != null) Files.createDirectories(root);
        if (pagesDir != null) Files.createDirectories(pagesDir);
        if (indexDir != null) Files.createDirectories(indexDir);
        if (modelsDir != null) Files.createDirectories(modelsDir);
    }

    /**
     * Hybrid search and rank fusion.
     */
    @Getter @Setter
    public static class Search {
        /** RRF damping constant. */
        private int rrfK = 60;
        private double keywordWeight = 0.4;
        private double vectorWeight = 0.6;
        private int defaultLimit = 10;
        /** Each backend is asked for {@code limit * candidateMultiplier} hits before fusion. */
        private int candidateMultiplier = 1;
    }

    @Getter @Setter
    public static class PageRange {
        private int maxPages = 10;
    }

    /**
     * Heading parsing heuristics.
     */
    @Getter @Setter
    public static class Structure {
        /** Heading remainders longer than this are split into title and section content. */
        private int directContentThreshold = 50;
        /** Upper bound for a title cut out of a long heading line. */
        private int maxTitleLength = 30;
    }

    @Getter @Setter
    public static class Index {
        private String keywordBackend = "lucene";
        private String vectorBackend = "lucene-hnsw";
        private int minVectorContentLength = 10;
        private int storedContentLength = 500;
        private int snippetLength = 200;
    }

    @Getter @Setter
    public static class Embedding {
        private String backend = "onnx";
        private int dimension = 512;
        private int maxTokens = 512;
        private String queryInstruction = "";
    }

    /**
     * Background ingestion queue.
     */
    @Getter @Setter
    public static class Ingestion {
        /** Pending ingestion requests; further submissions are rejected. */
        private int queueCapacity = 16;
        private int awaitTerminationSeconds = 60;
    }
}
