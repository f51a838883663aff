package my.chatcontext.context;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ranks document chunks against a query by keyword overlap.
 * <p>
 * A query keyword counts as matched when it is a substring of some chunk keyword
 * or the other way round; the score is the matched fraction of the query keywords.
 * Chunks scoring above the threshold are ranked and capped. When none qualifies
 * the best chunks are returned anyway, so a question almost always gets some
 * background.
 */
public class RelevanceScorer {

	private static final Logger logger = LoggerFactory.getLogger(RelevanceScorer.class);

	public static final double DEFAULT_RELEVANCE_THRESHOLD = 0.05;
	public static final int DEFAULT_MAX_CHUNKS = 5;
	public static final int DEFAULT_FALLBACK_CHUNKS = 2;

	private static final Comparator<ScoredContextChunk> BY_SCORE_DESC = Comparator
			.comparingDouble(ScoredContextChunk::relevanceScore)
			.reversed();

	private final KeywordExtractor keywordExtractor;
	private final double relevanceThreshold;
	private final int maxChunks;
	private final int fallbackChunks;

	public RelevanceScorer(KeywordExtractor keywordExtractor) {
		this(keywordExtractor, DEFAULT_RELEVANCE_THRESHOLD, DEFAULT_MAX_CHUNKS, DEFAULT_FALLBACK_CHUNKS);
	}

	public RelevanceScorer(KeywordExtractor keywordExtractor, double relevanceThreshold, int maxChunks,
			int fallbackChunks) {
		this.keywordExtractor = Objects.requireNonNull(keywordExtractor, "keywordExtractor");
		this.relevanceThreshold = relevanceThreshold;
		this.maxChunks = Math.max(0, maxChunks);
		this.fallbackChunks = Math.max(0, Math.min(fallbackChunks, this.maxChunks));
	}

	/**
	 * Selects the chunks to show for {@code query}, best first.
	 *
	 * @return an empty list only when {@code chunks} is empty (or the configured caps are zero)
	 */
	public List<ScoredContextChunk> selectChunks(String query, List<ContextChunk> chunks) {
		if (chunks == null || chunks.isEmpty()) {
			return List.of();
		}
		List<String> queryKeywords = keywordExtractor.extract(query);
		logger.debug("Query keywords: {}", queryKeywords);

		List<ScoredContextChunk> scored = new ArrayList<>(chunks.size());
		for (ContextChunk chunk : chunks) {
			scored.add(new ScoredContextChunk(chunk, score(queryKeywords, chunk.keywords())));
		}

		// both sorts are stable, ties keep document order
		List<ScoredContextChunk> relevant = scored.stream()
				.filter(candidate -> candidate.relevanceScore() > relevanceThreshold)
				.sorted(BY_SCORE_DESC)
				.limit(maxChunks)
				.toList();
		if (!relevant.isEmpty()) {
			logger.debug("Selected {} of {} chunks above threshold {}", relevant.size(), chunks.size(),
					relevanceThreshold);
			return relevant;
		}

		List<ScoredContextChunk> ranked = new ArrayList<>(scored);
		ranked.sort(BY_SCORE_DESC);
		List<ScoredContextChunk> fallback = List.copyOf(ranked.subList(0, Math.min(fallbackChunks, ranked.size())));
		logger.warn("No chunk scored above {}; falling back to the top {} chunks", relevanceThreshold,
				fallback.size());
		return fallback;
	}

	public double score(String query, ContextChunk chunk) {
		if (chunk == null) {
			return 0.0;
		}
		return score(keywordExtractor.extract(query), chunk.keywords());
	}

	static double score(List<String> queryKeywords, List<String> chunkKeywords) {
		if (queryKeywords.isEmpty() || chunkKeywords.isEmpty()) {
			return 0.0;
		}
		long matched = queryKeywords.stream()
				.filter(keyword -> matchesAny(keyword, chunkKeywords))
				.count();
		return (double) matched / queryKeywords.size();
	}

	private static boolean matchesAny(String queryKeyword, List<String> chunkKeywords) {
		String query = queryKeyword.toLowerCase(Locale.ROOT);
		for (String chunkKeyword : chunkKeywords) {
			String candidate = chunkKeyword.toLowerCase(Locale.ROOT);
			if (candidate.contains(query) || query.contains(candidate)) {
				return true;
			}
		}
		return false;
	}

	public double getRelevanceThreshold() {
		return relevanceThreshold;
	}

	public int getMaxChunks() {
		return maxChunks;
	}

	public int getFallbackChunks() {
		return fallbackChunks;
	}
}
