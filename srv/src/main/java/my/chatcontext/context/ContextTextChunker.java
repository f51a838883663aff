package my.chatcontext.context;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a markdown document into sections at its headers and each section into
 * overlapping word windows.
 */
public class ContextTextChunker {

	public static final int DEFAULT_CHUNK_SIZE = 500;
	public static final int DEFAULT_CHUNK_OVERLAP = 50;

	private static final Pattern HEADER = Pattern.compile("^#{1,6}\\s+(.*)$");
	private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

	private final int chunkSize;
	private final int chunkOverlap;

	public ContextTextChunker() {
		this(DEFAULT_CHUNK_SIZE, DEFAULT_CHUNK_OVERLAP);
	}

	public ContextTextChunker(int chunkSize, int chunkOverlap) {
		this.chunkSize = Math.max(1, chunkSize);
		// overlap must stay below the window size so every step moves forward
		this.chunkOverlap = Math.max(0, Math.min(chunkOverlap, this.chunkSize - 1));
	}

	public List<ContextTextChunk> chunk(String text) {
		if (text == null || text.isBlank()) {
			return List.of();
		}
		List<ContextTextChunk> chunks = new ArrayList<>();
		for (Section section : splitSections(text)) {
			appendSection(chunks, section);
		}
		return chunks;
	}

	public int getChunkSize() {
		return chunkSize;
	}

	public int getChunkOverlap() {
		return chunkOverlap;
	}

	private List<Section> splitSections(String text) {
		List<Section> sections = new ArrayList<>();
		String title = null;
		StringBuilder content = new StringBuilder();
		for (String line : text.split("\\r?\\n", -1)) {
			Matcher header = HEADER.matcher(line);
			if (header.matches()) {
				addIfNotBlank(sections, title, content);
				title = header.group(1).trim();
				content = new StringBuilder();
			}
			content.append(line).append('\n');
		}
		addIfNotBlank(sections, title, content);
		return sections;
	}

	private void addIfNotBlank(List<Section> sections, String title, StringBuilder content) {
		if (!content.toString().isBlank()) {
			sections.add(new Section(title == null || title.isEmpty() ? null : title, content.toString()));
		}
	}

	private void appendSection(List<ContextTextChunk> accumulator, Section section) {
		List<String> words = Arrays.stream(WHITESPACE.split(section.content()))
				.filter(word -> !word.isEmpty())
				.toList();
		int step = chunkSize - chunkOverlap;
		for (int start = 0; start < words.size(); start += step) {
			int end = Math.min(words.size(), start + chunkSize);
			String window = String.join(" ", words.subList(start, end)).trim();
			if (!window.isEmpty()) {
				accumulator.add(new ContextTextChunk(window, section.title()));
			}
		}
	}

	private record Section(String title, String content) {
	}
}
