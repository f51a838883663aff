package my.chatcontext.context;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A retrievable span of the background document together with its keywords.
 */
public record ContextChunk(String id, String text, List<String> keywords, String sectionTitle) {

	public ContextChunk {
		Objects.requireNonNull(id, "id");
		if (text == null || text.trim().isEmpty()) {
			throw new IllegalArgumentException("Chunk text must not be blank");
		}
		keywords = keywords == null ? List.of() : List.copyOf(keywords);
	}

	public Optional<String> section() {
		return Optional.ofNullable(sectionTitle);
	}
}
