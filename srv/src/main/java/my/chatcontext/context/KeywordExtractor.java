package my.chatcontext.context;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Derives an ordered, duplicate free keyword list from free text.
 * <p>
 * Chunk keywords are computed when the document is loaded and query keywords
 * when a question arrives, so the result must depend on nothing but the text.
 */
public class KeywordExtractor {

	public static final int DEFAULT_MIN_KEYWORD_LENGTH = 3;
	public static final int DEFAULT_MAX_KEYWORDS = 20;

	private static final Pattern MARKDOWN = Pattern.compile("[#*`_\\[\\]()]");
	private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]");
	private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

	static final Set<String> STOP_WORDS = Set.of(
			"the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
			"from", "up", "about", "into", "through", "during", "before", "after", "above", "below",
			"is", "are", "was", "were", "be", "been", "being", "have", "has", "had", "do", "does", "did",
			"will", "would", "could", "should", "may", "might", "must", "can",
			"this", "that", "these", "those");

	private final int minKeywordLength;
	private final int maxKeywords;

	public KeywordExtractor() {
		this(DEFAULT_MIN_KEYWORD_LENGTH, DEFAULT_MAX_KEYWORDS);
	}

	public KeywordExtractor(int minKeywordLength, int maxKeywords) {
		this.minKeywordLength = Math.max(1, minKeywordLength);
		this.maxKeywords = Math.max(0, maxKeywords);
	}

	public List<String> extract(String text) {
		if (text == null || text.isBlank()) {
			return List.of();
		}
		String normalized = normalize(text);
		if (normalized.isEmpty()) {
			return List.of();
		}
		Set<String> keywords = new LinkedHashSet<>();
		for (String token : WHITESPACE.split(normalized)) {
			if (keywords.size() >= maxKeywords) {
				break;
			}
			if (isKeyword(token)) {
				keywords.add(token);
			}
		}
		return List.copyOf(keywords);
	}

	private String normalize(String text) {
		String cleaned = MARKDOWN.matcher(text).replaceAll(" ").toLowerCase(Locale.ROOT);
		cleaned = NON_WORD.matcher(cleaned).replaceAll(" ");
		return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
	}

	private boolean isKeyword(String token) {
		return token.length() >= minKeywordLength && !STOP_WORDS.contains(token);
	}
}
