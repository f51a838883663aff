package my.chatcontext.handlers;

import my.chatcontext.context.ContextService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Loads the background document once the application has started and drops it on shutdown.
 */
@Component
class ContextStartupHandler implements ApplicationRunner, DisposableBean {

	private static final Logger logger = LoggerFactory.getLogger(ContextStartupHandler.class);

	private final ContextService contextService;

	ContextStartupHandler(ContextService contextService) {
		this.contextService = contextService;
	}

	@Override
	public void run(ApplicationArguments args) {
		if (!contextService.isEnabled()) {
			logger.info("Context injection is disabled; skipping document load.");
			return;
		}
		contextService.initialize();
		if (contextService.isAvailable()) {
			logger.info("Context available with {} chunks from {}", contextService.stats().chunkCount(),
					contextService.getDocumentPath());
		} else {
			logger.info("No usable context document at {}; refresh after creating it.",
					contextService.getDocumentPath());
		}
	}

	@Override
	public void destroy() {
		contextService.cleanup();
	}
}
