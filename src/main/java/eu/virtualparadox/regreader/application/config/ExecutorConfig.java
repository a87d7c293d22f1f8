package eu.virtualparadox.regreader.application.config;

import eu.virtualparadox.regreader.application.executor.IngestionExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    /**
     * Single worker, so two collections are never written to the indexes at the same time.
     * Queued imports finish before shutdown.
     */
    @Bean
    public IngestionExecutor ingestionExecutor(final ApplicationConfig props) {
        final ApplicationConfig.Ingestion ingestion = props.getIngestion();
        final IngestionExecutor executor = new IngestionExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(ingestion.getQueueCapacity());
        executor.setThreadNamePrefix("regreader-ingest-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(ingestion.getAwaitTerminationSeconds());
        executor.initialize();
        return executor;
    }
}
