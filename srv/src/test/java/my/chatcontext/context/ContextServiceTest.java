package my.chatcontext.context;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import my.chatcontext.repository.ContextDocumentRepository;
import my.chatcontext.repository.InMemoryDocumentStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ContextServiceTest {

	private static final String DOCUMENT = "# About\nI like Rust and Go.\n# Hobbies\nI enjoy chess.";
	private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
	private static final Instant MODIFIED = Instant.parse("2024-05-30T08:00:00Z");

	private InMemoryDocumentStorage storage;
	private ContextService service;

	@BeforeEach
	void setUp() {
		storage = new InMemoryDocumentStorage();
		service = newService(new ContextTextChunker(), true);
	}

	@Test
	void answersWithMatchingSection() {
		storage.put("context.md", DOCUMENT, MODIFIED);

		String prompt = service.queryContext("What languages do you like?");

		assertThat(prompt).contains("**About:**", "Rust", "Go").doesNotContain("chess");
	}

	@Test
	void queryInitializesLazily() {
		storage.put("context.md", DOCUMENT, MODIFIED);

		assertThat(service.isAvailable()).isFalse();
		assertThat(service.queryContext("chess")).contains("I enjoy chess.");
		assertThat(service.isAvailable()).isTrue();
	}

	@Test
	void zeroByteDocumentIsUnavailable() {
		storage.put("context.md", "", MODIFIED);

		service.initialize();

		assertThat(service.isAvailable()).isFalse();
		assertThat(service.queryContext("anything at all")).isNull();
	}

	@Test
	void missingDocumentIsUnavailable() {
		assertThat(service.refresh()).isFalse();
		assertThat(service.queryContext("anything")).isNull();
	}

	@Test
	void stopWordQueryFallsBackToFirstChunks() {
		storage.put("context.md", DOCUMENT + "\n# Work\nI write code.", MODIFIED);

		String prompt = service.queryContext("the and of");

		assertThat(prompt).contains("I like Rust and Go.", "I enjoy chess.").doesNotContain("I write code.");
	}

	@Test
	void becomesUnavailableWhenDocumentIsDeleted() {
		storage.put("context.md", DOCUMENT, MODIFIED);
		assertThat(service.refresh()).isTrue();

		storage.delete("context.md");

		assertThat(service.refresh()).isFalse();
		assertThat(service.isAvailable()).isFalse();
		assertThat(service.queryContext("Rust")).isNull();
	}

	@Test
	void refreshOfUnchangedDocumentYieldsEqualChunks() {
		storage.put("context.md", DOCUMENT, MODIFIED);
		service.refresh();
		List<ContextChunk> first = service.getChunks();

		service.forceRefresh();

		assertThat(service.getChunks()).isEqualTo(first).isNotSameAs(first);
	}

	@Test
	void initializeDoesNotRetryAfterFailedLoad() {
		service.initialize();
		storage.put("context.md", DOCUMENT, MODIFIED);

		service.initialize();
		assertThat(service.queryContext("Rust")).isNull();

		assertThat(service.refresh()).isTrue();
		assertThat(service.queryContext("Rust")).contains("Rust");
	}

	@Test
	void reportsStatsWithoutReadingStorage() {
		storage.put("context.md", DOCUMENT, MODIFIED);
		service.refresh();
		storage.failReads(true);

		ContextStats stats = service.stats();

		assertThat(stats).isEqualTo(new ContextStats(true, 2, DOCUMENT.length(), MODIFIED, NOW));
	}

	@Test
	void statsBeforeAnyRefresh() {
		assertThat(service.stats()).isEqualTo(new ContextStats(false, 0, 0L, null, null));
	}

	@Test
	void cleanupReturnsToInitialState() {
		storage.put("context.md", DOCUMENT, MODIFIED);
		service.refresh();

		service.cleanup();
		service.cleanup();

		assertThat(service.isAvailable()).isFalse();
		assertThat(service.stats()).isEqualTo(new ContextStats(false, 0, 0L, null, null));
		assertThat(service.queryContext("Rust")).contains("Rust");
	}

	@Test
	void processingFailureMakesContextUnavailable() {
		ContextTextChunker failing = new ContextTextChunker() {
			@Override
			public List<ContextTextChunk> chunk(String text) {
				throw new IllegalStateException("malformed input");
			}
		};
		ContextService broken = newService(failing, true);
		storage.put("context.md", DOCUMENT, MODIFIED);

		assertThat(broken.refresh()).isFalse();
		assertThat(broken.queryContext("Rust")).isNull();
		assertThat(broken.stats().lastRefreshed()).isEqualTo(NOW);
	}

	@Test
	void readFailureMakesContextUnavailable() {
		storage.put("context.md", DOCUMENT, MODIFIED);
		storage.failReads(true);

		assertThat(service.refresh()).isFalse();
	}

	@Test
	void disabledServiceNeverAnswers() {
		ContextService disabled = newService(new ContextTextChunker(), false);
		storage.put("context.md", DOCUMENT, MODIFIED);

		assertThat(disabled.queryContext("Rust")).isNull();
		assertThat(disabled.isAvailable()).isFalse();
	}

	@Test
	void augmentsQuestionWithContextMessage() {
		storage.put("context.md", DOCUMENT, MODIFIED);

		List<ChatMessage> messages = service.augment("Do I like Rust?");

		assertThat(messages).hasSize(2);
		assertThat(((SystemMessage) messages.get(0)).text()).contains("I like Rust and Go.");
		assertThat(service.augment("  ")).isEmpty();
	}

	@Test
	void exposesDocumentPath() {
		assertThat(service.getDocumentPath()).isEqualTo("memory:context.md");
	}

	private ContextService newService(ContextTextChunker chunker, boolean enabled) {
		KeywordExtractor extractor = new KeywordExtractor();
		return new ContextService(
				new ContextDocumentRepository(storage, "context.md"),
				chunker,
				extractor,
				new RelevanceScorer(extractor),
				new ContextPromptBuilder(),
				enabled,
				Clock.fixed(NOW, ZoneOffset.UTC));
	}
}
