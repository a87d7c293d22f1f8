package eu.virtualparadox.regreader.storage.model;

import java.time.Instant;

/**
 * Descriptive record stored next to the pages of a regulation.
 */
public record RegulationInfo(String regId,
                             String title,
                             String sourceFile,
                             int totalPages,
                             Instant indexedAt) {
}
