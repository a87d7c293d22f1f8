package eu.virtualparadox.regreader.util;

import ai.onnxruntime.OrtSession;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OrtInitializer {

    private OrtInitializer() {
        // Prevent instantiation
    }

    /**
     * Builds CPU session options for the embedding model, keeping one core free for
     * ingestion and search threads.
     *
     * @return session options
     */
    public static OrtSession.SessionOptions initializeOrt() {
        try {
            final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();

            final int intraThreads = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
            opts.setIntraOpNumThreads(intraThreads);
            opts.setInterOpNumThreads(1);
            opts.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);

            log.info("ONNX session: intra-op threads {}, inter-op threads {}", intraThreads, 1);
            return opts;
        }
        catch (Exception e) {
            throw new IllegalStateException("Failed to initialize ONNX Runtime", e);
        }
    }
}
