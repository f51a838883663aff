package my.chatcontext.repository;

import java.io.IOException;

/**
 * A {@link DocumentStorage} that can also replace or remove documents.
 */
public interface WritableDocumentStorage extends DocumentStorage {

	void writeText(String name, String text) throws IOException;

	/**
	 * @return {@code true} if a document was removed, {@code false} if there was nothing to remove.
	 */
	boolean delete(String name) throws IOException;
}
