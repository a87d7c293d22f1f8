package eu.virtualparadox.regreader.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor dedicated to regulation ingestion, so long imports never compete with query threads.
 */
public class IngestionExecutor extends ThreadPoolTaskExecutor {
}
