package my.chatcontext.repository;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;

/**
 * Reads and writes UTF-8 documents below a fixed base directory.
 */
public class FileSystemDocumentStorage implements WritableDocumentStorage {

	private final Path baseDirectory;

	public FileSystemDocumentStorage(Path baseDirectory) {
		this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory").toAbsolutePath().normalize();
	}

	@Override
	public boolean exists(String name) {
		return Files.isRegularFile(resolve(name));
	}

	@Override
	public String readText(String name) throws IOException {
		return Files.readString(resolve(name), StandardCharsets.UTF_8);
	}

	@Override
	public DocumentMetadata statMeta(String name) throws IOException {
		BasicFileAttributes attributes = Files.readAttributes(resolve(name), BasicFileAttributes.class);
		return new DocumentMetadata(attributes.size(), attributes.lastModifiedTime().toInstant());
	}

	@Override
	public String describe(String name) {
		return resolve(name).toString();
	}

	@Override
	public void writeText(String name, String text) throws IOException {
		Path target = resolve(name);
		Files.createDirectories(target.getParent());
		Files.writeString(target, text == null ? "" : text, StandardCharsets.UTF_8);
	}

	@Override
	public boolean delete(String name) throws IOException {
		return Files.deleteIfExists(resolve(name));
	}

	private Path resolve(String name) {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Document name must not be blank");
		}
		Path resolved = baseDirectory.resolve(name).normalize();
		if (!resolved.startsWith(baseDirectory)) {
			throw new IllegalArgumentException("Document name escapes the base directory: " + name);
		}
		return resolved;
	}
}
