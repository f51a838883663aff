package my.chatcontext.repository;

import java.time.Instant;

/**
 * Size and last modification time of a stored document.
 */
public record DocumentMetadata(long sizeBytes, Instant modifiedAt) {
}
