package my.chatcontext.context;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import dev.langchain4j.data.message.ChatMessage;
import my.chatcontext.repository.ContextDocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the one cached version of the background document and answers context
 * queries against it.
 * <p>
 * Refresh is manual: the document is only re-read by {@link #initialize()},
 * {@link #refresh()} and {@link #forceRefresh()}. Every state change is a single
 * assignment of an immutable {@link State}, so a reader sees either the old chunk
 * list or the new one. Calls to {@link #refresh()} and {@link #queryContext(String)}
 * must still be serialized by the caller.
 * <p>
 * None of the retrieval methods throw; a missing or broken document only makes
 * the context unavailable.
 */
public class ContextService {

	private static final Logger logger = LoggerFactory.getLogger(ContextService.class);

	private final ContextDocumentRepository documentRepository;
	private final ContextTextChunker chunker;
	private final KeywordExtractor keywordExtractor;
	private final RelevanceScorer relevanceScorer;
	private final ContextPromptBuilder promptBuilder;
	private final boolean enabled;
	private final Clock clock;

	private volatile State state = State.INITIAL;

	public ContextService(ContextDocumentRepository documentRepository, ContextTextChunker chunker,
			KeywordExtractor keywordExtractor, RelevanceScorer relevanceScorer, ContextPromptBuilder promptBuilder,
			boolean enabled) {
		this(documentRepository, chunker, keywordExtractor, relevanceScorer, promptBuilder, enabled,
				Clock.systemUTC());
	}

	public ContextService(ContextDocumentRepository documentRepository, ContextTextChunker chunker,
			KeywordExtractor keywordExtractor, RelevanceScorer relevanceScorer, ContextPromptBuilder promptBuilder,
			boolean enabled, Clock clock) {
		this.documentRepository = Objects.requireNonNull(documentRepository, "documentRepository");
		this.chunker = Objects.requireNonNull(chunker, "chunker");
		this.keywordExtractor = Objects.requireNonNull(keywordExtractor, "keywordExtractor");
		this.relevanceScorer = Objects.requireNonNull(relevanceScorer, "relevanceScorer");
		this.promptBuilder = Objects.requireNonNull(promptBuilder, "promptBuilder");
		this.enabled = enabled;
		this.clock = Objects.requireNonNull(clock, "clock");
	}

	/**
	 * Loads the document on first use. Later calls do nothing, also when the first load failed.
	 */
	public void initialize() {
		if (state.initialized()) {
			return;
		}
		logger.info("Initializing context from {}", documentRepository.describe());
		reload();
	}

	/**
	 * Re-reads and re-chunks the document.
	 *
	 * @return whether context is available afterwards
	 */
	public boolean refresh() {
		reload();
		return isAvailable();
	}

	public boolean forceRefresh() {
		return refresh();
	}

	public boolean isAvailable() {
		return state.isAvailable();
	}

	public boolean isEnabled() {
		return enabled;
	}

	/**
	 * Builds the context block for {@code query}.
	 *
	 * @return the context prompt, or {@code null} when context is disabled or unavailable
	 */
	public String queryContext(String query) {
		if (!enabled) {
			return null;
		}
		try {
			if (!state.initialized()) {
				initialize();
			}
			State current = state;
			if (!current.isAvailable()) {
				logger.debug("Context not available, no document or document empty");
				return null;
			}
			List<ScoredContextChunk> selected = relevanceScorer.selectChunks(query, current.chunks());
			if (selected.isEmpty()) {
				logger.debug("No context chunk selected for query");
				return null;
			}
			String prompt = promptBuilder.buildPrompt(query, selected);
			logger.debug("Built context prompt from {} chunks ({} chars)", selected.size(), prompt.length());
			return prompt.isEmpty() ? null : prompt;
		} catch (RuntimeException e) {
			logger.warn("Failed to build context for query: {}", e.getMessage(), e);
			return null;
		}
	}

	/**
	 * Messages to send for {@code question}: the context block as a system message
	 * when there is one, then the question.
	 */
	public List<ChatMessage> augment(String question) {
		if (question == null || question.isBlank()) {
			return List.of();
		}
		return promptBuilder.buildMessages(queryContext(question), question);
	}

	public ContextStats stats() {
		State current = state;
		if (!current.isAvailable()) {
			return new ContextStats(false, 0, 0L, null, current.lastRefreshed());
		}
		SourceDocument document = current.document();
		return new ContextStats(true, current.chunks().size(), document.sizeBytes(), document.modifiedAt(),
				current.lastRefreshed());
	}

	public String getDocumentPath() {
		return documentRepository.describe();
	}

	public void cleanup() {
		state = State.INITIAL;
		logger.info("Context cleaned up");
	}

	/**
	 * @return the chunks of the current document version, empty when unavailable
	 */
	public List<ContextChunk> getChunks() {
		return state.chunks();
	}

	private void reload() {
		Instant refreshedAt = clock.instant();
		try {
			Optional<SourceDocument> loaded = documentRepository.load();
			if (loaded.isEmpty()) {
				state = new State(null, List.of(), refreshedAt, true);
				logger.info("No context document found at {} or document is empty", documentRepository.describe());
				return;
			}
			SourceDocument document = loaded.get();
			List<ContextChunk> chunks = buildChunks(document.rawText());
			state = new State(document, chunks, refreshedAt, true);
			logger.info("Context refreshed: {} chunks from {} bytes", chunks.size(), document.sizeBytes());
		} catch (RuntimeException e) {
			logger.warn("Failed to process context document {}: {}", documentRepository.describe(), e.getMessage(),
					e);
			state = new State(null, List.of(), refreshedAt, true);
		}
	}

	private List<ContextChunk> buildChunks(String text) {
		List<ContextTextChunk> windows = chunker.chunk(text);
		List<ContextChunk> chunks = new ArrayList<>(windows.size());
		for (int index = 0; index < windows.size(); index++) {
			ContextTextChunk window = windows.get(index);
			chunks.add(new ContextChunk(
					chunkId(index, window.text()),
					window.text(),
					keywordExtractor.extract(window.text()),
					window.sectionTitle()));
		}
		return List.copyOf(chunks);
	}

	private static String chunkId(int index, String text) {
		return UUID.nameUUIDFromBytes((index + ":" + text).getBytes(StandardCharsets.UTF_8)).toString();
	}

	private record State(SourceDocument document, List<ContextChunk> chunks, Instant lastRefreshed,
			boolean initialized) {

		static final State INITIAL = new State(null, List.of(), null, false);

		boolean isAvailable() {
			return document != null && document.valid() && !chunks.isEmpty();
		}
	}
}
