package my.chatcontext.service;

import java.io.IOException;
import my.chatcontext.context.ContextService;
import my.chatcontext.repository.ContextDocumentRepository;
import my.chatcontext.repository.WritableDocumentStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Creates or removes the background document and reloads the context afterwards.
 */
@Service
public class SampleContextService {

	private static final Logger logger = LoggerFactory.getLogger(SampleContextService.class);

	static final String SAMPLE_DOCUMENT = """
			# My Personal Knowledge Base

			## About Me
			I'm a Java developer working on a chat assistant backed by a local language model. \
			I have 3 years of experience with Spring and I'm learning about AI integration.

			## Current Project
			I'm building a chat application that lets users talk to AI models running on their own machine. \
			The application features:
			- Model selection and downloading
			- Local model execution
			- Dark and light theme support
			- Context integration from markdown files

			## Technical Stack
			- Java 17 with Spring Boot
			- LangChain4j for prompt and message handling
			- SLF4J and Logback for logging
			- JUnit 5 and AssertJ for tests

			## Preferences
			- I prefer clean, minimal user interfaces
			- I like using descriptive variable names
			- I always add proper error handling
			- I prefer small immutable value types over mutable beans

			## Goals
			- Learn about Model Context Protocol integration
			- Improve the user experience of local AI assistants
			- Understand local model optimization
			- Build production-ready Java services

			## Notes
			When building the context feature, remember to:
			- Keep the interface simple and intuitive
			- Handle file errors gracefully
			- Provide clear feedback to users
			- Make the feature optional and toggleable
			""";

	private final WritableDocumentStorage storage;
	private final ContextDocumentRepository documentRepository;
	private final ContextService contextService;

	public SampleContextService(WritableDocumentStorage storage, ContextDocumentRepository documentRepository,
			ContextService contextService) {
		this.storage = storage;
		this.documentRepository = documentRepository;
		this.contextService = contextService;
	}

	/**
	 * Writes the built-in sample document, replacing any existing one.
	 *
	 * @return whether context is available after the reload
	 */
	public boolean installSample() {
		try {
			storage.writeText(documentRepository.getDocumentName(), SAMPLE_DOCUMENT);
			logger.info("Sample context document written to {}", documentRepository.describe());
		} catch (IOException | RuntimeException e) {
			logger.warn("Failed to write sample context document to {}: {}", documentRepository.describe(),
					e.getMessage());
			return false;
		}
		return contextService.forceRefresh();
	}

	/**
	 * Deletes the document if present.
	 *
	 * @return {@code true} unless the deletion failed
	 */
	public boolean removeDocument() {
		try {
			if (storage.delete(documentRepository.getDocumentName())) {
				logger.info("Context document {} deleted", documentRepository.describe());
			} else {
				logger.debug("No context document to delete at {}", documentRepository.describe());
			}
		} catch (IOException | RuntimeException e) {
			logger.warn("Failed to delete context document {}: {}", documentRepository.describe(), e.getMessage());
			return false;
		}
		contextService.forceRefresh();
		return true;
	}
}
