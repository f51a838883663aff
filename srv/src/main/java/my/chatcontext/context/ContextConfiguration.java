package my.chatcontext.context;

import java.nio.file.Path;
import my.chatcontext.repository.ContextDocumentRepository;
import my.chatcontext.repository.FileSystemDocumentStorage;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the retrieval stages from {@link ContextProperties}. Values are copied
 * into the stages once, at startup.
 */
@Configuration
public class ContextConfiguration {

	private final ContextProperties properties;

	public ContextConfiguration(ContextProperties properties) {
		this.properties = properties;
	}

	@Bean
	public FileSystemDocumentStorage documentStorage() {
		return new FileSystemDocumentStorage(Path.of(properties.getDocumentDirectory()));
	}

	@Bean
	public ContextDocumentRepository contextDocumentRepository(FileSystemDocumentStorage documentStorage) {
		return new ContextDocumentRepository(documentStorage, properties.getDocumentName());
	}

	@Bean
	public ContextTextChunker contextTextChunker() {
		return new ContextTextChunker(properties.getChunkSize(), properties.getChunkOverlap());
	}

	@Bean
	public KeywordExtractor keywordExtractor() {
		return new KeywordExtractor(properties.getMinKeywordLength(), properties.getMaxKeywords());
	}

	@Bean
	public RelevanceScorer relevanceScorer(KeywordExtractor keywordExtractor) {
		return new RelevanceScorer(
				keywordExtractor,
				properties.getRelevanceThreshold(),
				properties.getMaxChunksPerQuery(),
				properties.getFallbackChunkCount());
	}

	@Bean
	public ContextService contextService(ContextDocumentRepository contextDocumentRepository,
			ContextTextChunker contextTextChunker, KeywordExtractor keywordExtractor,
			RelevanceScorer relevanceScorer, ContextPromptBuilder contextPromptBuilder) {
		return new ContextService(
				contextDocumentRepository,
				contextTextChunker,
				keywordExtractor,
				relevanceScorer,
				contextPromptBuilder,
				properties.isEnabled());
	}
}
