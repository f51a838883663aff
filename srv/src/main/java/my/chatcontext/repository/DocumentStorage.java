package my.chatcontext.repository;

import java.io.IOException;

/**
 * Storage backend the background document is read from.
 * <p>
 * Names are resolved by the backend; the engine only ever asks for the one
 * conventional document name it was configured with.
 */
public interface DocumentStorage {

	boolean exists(String name);

	String readText(String name) throws IOException;

	DocumentMetadata statMeta(String name) throws IOException;

	/**
	 * @return human readable location of {@code name}, used for display only.
	 */
	String describe(String name);
}
