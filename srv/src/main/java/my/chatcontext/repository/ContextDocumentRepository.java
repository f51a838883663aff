package my.chatcontext.repository;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import my.chatcontext.context.SourceDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the background document and its metadata from the configured storage.
 * <p>
 * Does no parsing and no caching. Any storage failure is logged and reported
 * as an absent document.
 */
public class ContextDocumentRepository {

	private static final Logger logger = LoggerFactory.getLogger(ContextDocumentRepository.class);

	private final DocumentStorage storage;
	private final String documentName;

	public ContextDocumentRepository(DocumentStorage storage, String documentName) {
		this.storage = Objects.requireNonNull(storage, "storage");
		this.documentName = Objects.requireNonNull(documentName, "documentName");
	}

	public boolean exists() {
		try {
			return storage.exists(documentName);
		} catch (RuntimeException e) {
			logger.warn("Could not check whether context document {} exists: {}", describe(), e.getMessage());
			return false;
		}
	}

	public Optional<SourceDocument> load() {
		if (!exists()) {
			logger.debug("No context document at {}", describe());
			return Optional.empty();
		}
		try {
			String text = storage.readText(documentName);
			DocumentMetadata metadata = storage.statMeta(documentName);
			SourceDocument document = SourceDocument.of(text, metadata.sizeBytes(), metadata.modifiedAt());
			if (!document.valid()) {
				logger.debug("Context document at {} is empty", describe());
				return Optional.empty();
			}
			return Optional.of(document);
		} catch (IOException | RuntimeException e) {
			logger.warn("Failed to read context document {}: {}", describe(), e.getMessage());
			return Optional.empty();
		}
	}

	public String describe() {
		try {
			return storage.describe(documentName);
		} catch (RuntimeException e) {
			return documentName;
		}
	}

	public String getDocumentName() {
		return documentName;
	}
}
