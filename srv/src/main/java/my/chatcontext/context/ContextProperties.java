package my.chatcontext.context;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "context")
public class ContextProperties {

	private String documentDirectory = System.getProperty("user.home") + "/.chat-context";
	private String documentName = "context.md";
	private boolean enabled = true;
	private int chunkSize = ContextTextChunker.DEFAULT_CHUNK_SIZE;
	private int chunkOverlap = ContextTextChunker.DEFAULT_CHUNK_OVERLAP;
	private int minKeywordLength = KeywordExtractor.DEFAULT_MIN_KEYWORD_LENGTH;
	private int maxKeywords = KeywordExtractor.DEFAULT_MAX_KEYWORDS;
	private double relevanceThreshold = RelevanceScorer.DEFAULT_RELEVANCE_THRESHOLD;
	private int maxChunksPerQuery = RelevanceScorer.DEFAULT_MAX_CHUNKS;
	private int fallbackChunkCount = RelevanceScorer.DEFAULT_FALLBACK_CHUNKS;

	public String getDocumentDirectory() {
		return documentDirectory;
	}

	public void setDocumentDirectory(String documentDirectory) {
		this.documentDirectory = documentDirectory;
	}

	public String getDocumentName() {
		return documentName;
	}

	public void setDocumentName(String documentName) {
		this.documentName = documentName;
	}

	public boolean isEnabled() {
		return enabled;
	}

	public void setEnabled(boolean enabled) {
		this.enabled = enabled;
	}

	public int getChunkSize() {
		return chunkSize;
	}

	public void setChunkSize(int chunkSize) {
		this.chunkSize = chunkSize;
	}

	public int getChunkOverlap() {
		return chunkOverlap;
	}

	public void setChunkOverlap(int chunkOverlap) {
		this.chunkOverlap = chunkOverlap;
	}

	public int getMinKeywordLength() {
		return minKeywordLength;
	}

	public void setMinKeywordLength(int minKeywordLength) {
		this.minKeywordLength = minKeywordLength;
	}

	public int getMaxKeywords() {
		return maxKeywords;
	}

	public void setMaxKeywords(int maxKeywords) {
		this.maxKeywords = maxKeywords;
	}

	public double getRelevanceThreshold() {
		return relevanceThreshold;
	}

	public void setRelevanceThreshold(double relevanceThreshold) {
		this.relevanceThreshold = relevanceThreshold;
	}

	public int getMaxChunksPerQuery() {
		return maxChunksPerQuery;
	}

	public void setMaxChunksPerQuery(int maxChunksPerQuery) {
		this.maxChunksPerQuery = maxChunksPerQuery;
	}

	public int getFallbackChunkCount() {
		return fallbackChunkCount;
	}

	public void setFallbackChunkCount(int fallbackChunkCount) {
		this.fallbackChunkCount = fallbackChunkCount;
	}
}
