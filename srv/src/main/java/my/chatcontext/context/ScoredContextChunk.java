package my.chatcontext.context;

/**
 * Holds the relevance of a chunk for a single query evaluation.
 */
public record ScoredContextChunk(ContextChunk chunk, double relevanceScore) {
}
