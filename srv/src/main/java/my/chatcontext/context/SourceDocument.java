package my.chatcontext.context;

import java.time.Instant;

/**
 * One loaded version of the background document. Replaced wholesale on every refresh.
 */
public record SourceDocument(String rawText, long sizeBytes, Instant modifiedAt, boolean valid) {

	public static SourceDocument of(String rawText, long sizeBytes, Instant modifiedAt) {
		String text = rawText == null ? "" : rawText;
		return new SourceDocument(text, sizeBytes, modifiedAt, !text.trim().isEmpty());
	}
}
