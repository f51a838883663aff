package my.chatcontext.context;

import java.util.ArrayList;
import java.util.List;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.input.Prompt;

import org.springframework.stereotype.Component;

@Component
public class ContextPromptBuilder {

	static final String PREAMBLE = "[CONTEXT ACTIVE] You have access to the following information about the user:";

	static final String INSTRUCTIONS = """
			Please use this information to provide personalized and relevant responses. \
			When the user asks about themselves, their projects, preferences, or anything related to the above \
			information, incorporate these details naturally into your response. \
			Start your response by acknowledging you have this context information.""";

	/**
	 * Formats the selected chunks into one context block.
	 *
	 * @param query the user's question, currently not part of the output
	 * @return the context block, or an empty string when nothing was selected
	 */
	public String buildPrompt(String query, List<ScoredContextChunk> selected) {
		if (selected == null || selected.isEmpty()) {
			return "";
		}
		List<String> sections = new ArrayList<>(selected.size());
		for (ScoredContextChunk scored : selected) {
			ContextChunk chunk = scored.chunk();
			String header = chunk.section().map(title -> "**" + title + ":**\n").orElse("");
			sections.add(header + chunk.text());
		}
		StringBuilder prompt = new StringBuilder();
		prompt.append(PREAMBLE).append("\n\n");
		prompt.append(String.join("\n\n", sections)).append("\n\n");
		prompt.append(INSTRUCTIONS);
		return prompt.toString();
	}

	/**
	 * Puts the context block ahead of the user's question as a system message.
	 * Without context only the question is returned.
	 */
	public List<ChatMessage> buildMessages(String contextPrompt, String question) {
		List<ChatMessage> messages = new ArrayList<>(2);
		if (contextPrompt != null && !contextPrompt.isBlank()) {
			messages.add(Prompt.from(contextPrompt).toSystemMessage());
		}
		messages.add(UserMessage.from(question));
		return messages;
	}
}
