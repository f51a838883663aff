package my.chatcontext.context;

/**
 * A window of section text produced by {@link ContextTextChunker}, before keywords are attached.
 *
 * @param sectionTitle title of the markdown section, {@code null} for text outside any header
 */
public record ContextTextChunk(String text, String sectionTitle) {
}
