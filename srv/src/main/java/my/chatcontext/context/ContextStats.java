package my.chatcontext.context;

import java.time.Instant;

/**
 * Snapshot of the cached document state, computed without touching storage.
 */
public record ContextStats(
		boolean available,
		int chunkCount,
		long fileSizeBytes,
		Instant lastModified,
		Instant lastRefreshed) {
}
