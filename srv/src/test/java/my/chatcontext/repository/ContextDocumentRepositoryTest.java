package my.chatcontext.repository;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.Optional;
import my.chatcontext.context.SourceDocument;
import org.junit.jupiter.api.Test;

class ContextDocumentRepositoryTest {

	private final InMemoryDocumentStorage storage = new InMemoryDocumentStorage();
	private final ContextDocumentRepository repository = new ContextDocumentRepository(storage, "context.md");

	@Test
	void loadsTextAndMetadata() {
		Instant modifiedAt = Instant.parse("2024-02-03T04:05:06Z");
		storage.put("context.md", "# About\nhello", modifiedAt);

		Optional<SourceDocument> loaded = repository.load();

		assertThat(loaded).isPresent();
		assertThat(loaded.get().rawText()).isEqualTo("# About\nhello");
		assertThat(loaded.get().sizeBytes()).isEqualTo(13L);
		assertThat(loaded.get().modifiedAt()).isEqualTo(modifiedAt);
		assertThat(loaded.get().valid()).isTrue();
	}

	@Test
	void missingDocumentIsAbsent() {
		assertThat(repository.exists()).isFalse();
		assertThat(repository.load()).isEmpty();
	}

	@Test
	void blankDocumentIsAbsent() {
		storage.put("context.md", "   \n\t ");

		assertThat(repository.exists()).isTrue();
		assertThat(repository.load()).isEmpty();
	}

	@Test
	void zeroByteDocumentIsAbsent() {
		storage.put("context.md", "");

		assertThat(repository.load()).isEmpty();
	}

	@Test
	void readFailureIsReportedAsAbsent() {
		storage.put("context.md", "some text");
		storage.failReads(true);

		assertThat(repository.load()).isEmpty();
	}

	@Test
	void describesLocationThroughStorage() {
		assertThat(repository.describe()).isEqualTo("memory:context.md");
	}
}
