package com.tryonai.backend.service.storage;

import com.tryonai.backend.config.properties.StorageProperties;
import com.tryonai.backend.entity.TryOnSession;
import com.tryonai.backend.enums.ArtifactKind;
import com.tryonai.backend.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.UUID;

/**
 * Keeps artifacts on the local file system under {@code app.storage.upload-dir}.
 * References look like {@code /uploads/users/<sessionId>_user.jpg}.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "app.storage", name = "type", havingValue = "local", matchIfMissing = true)
public class LocalStorageGateway implements StorageGateway {

	static final String REF_PREFIX = "/uploads/";

	private final StorageProperties storageProperties;
	private final Path uploadRoot;

	public LocalStorageGateway(StorageProperties storageProperties) {
		this.storageProperties = storageProperties;
		this.uploadRoot = Paths.get(storageProperties.getUploadDir()).toAbsolutePath().normalize();
		try {
			for (ArtifactKind kind : ArtifactKind.values()) {
				Files.createDirectories(uploadRoot.resolve(kind.getFolder()));
			}
		} catch (IOException e) {
			throw new UncheckedIOException("Could not create upload directories under " + uploadRoot, e);
		}
		log.info("Local artifact storage at {}", uploadRoot);
	}

	@Override
	public String validate(MultipartFile file, ArtifactKind kind) {
		return UploadValidator.validate(file, kind, storageProperties);
	}

	@Override
	public String validateAndSave(UUID sessionId, MultipartFile file, ArtifactKind kind) {
		String extension = validate(file, kind);
		String fileName = sessionId + "_" + kind.getTag() + "." + extension;
		Path target = uploadRoot.resolve(kind.getFolder()).resolve(fileName);

		try (InputStream in = file.getInputStream()) {
			Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
		} catch (IOException e) {
			FileUtils.deleteQuietly(target.toFile());
			log.error("Failed to save {} image for session {}: {}", kind.getTag(), sessionId, e.getMessage());
			throw new UncheckedIOException("Error saving " + kind.getTag() + " image", e);
		}

		boolean valid;
		try (InputStream in = Files.newInputStream(target)) {
			valid = ImageVerifier.isValidImage(in, extension);
		} catch (IOException e) {
			valid = false;
		}
		if (!valid) {
			FileUtils.deleteQuietly(target.toFile());
			throw new InvalidInputException(InvalidInputException.Reason.CORRUPT_IMAGE,
					"Error processing " + kind.getTag() + " image: file is not a valid image");
		}

		log.info("Saved {} image for session {} -> {}", kind.getTag(), sessionId, target);
		return REF_PREFIX + kind.getFolder() + "/" + fileName;
	}

	@Override
	public String saveOutput(UUID sessionId, Path source) throws IOException {
		String extension = FilenameUtils.getExtension(source.getFileName().toString()).toLowerCase(Locale.ROOT);
		if (extension.isEmpty()) {
			extension = "png";
		}
		String fileName = sessionId + "_" + ArtifactKind.OUTPUT.getTag() + "." + extension;
		Path target = uploadRoot.resolve(ArtifactKind.OUTPUT.getFolder()).resolve(fileName);
		Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
		log.info("Saved output for session {} -> {}", sessionId, target);
		return REF_PREFIX + ArtifactKind.OUTPUT.getFolder() + "/" + fileName;
	}

	@Override
	public InputStream openStream(String ref) throws IOException {
		return Files.newInputStream(toPath(ref));
	}

	@Override
	public URI resolve(String ref) {
		return toPath(ref).toUri();
	}

	@Override
	public boolean exists(String ref) {
		if (isPlaceholder(ref)) {
			return false;
		}
		return Files.isRegularFile(toPath(ref));
	}

	@Override
	public boolean delete(String ref) {
		if (isPlaceholder(ref)) {
			return false;
		}
		Path path = toPath(ref);
		try {
			boolean deleted = Files.deleteIfExists(path);
			if (deleted) {
				log.info("Deleted {}", path);
			}
			return deleted;
		} catch (IOException e) {
			throw new UncheckedIOException("Could not delete " + path, e);
		}
	}

	@Override
	public String type() {
		return "local";
	}

	Path toPath(String ref) {
		String relative = ref.startsWith(REF_PREFIX) ? ref.substring(REF_PREFIX.length()) : ref.replaceFirst("^/+", "");
		Path path = uploadRoot.resolve(relative).normalize();
		if (!path.startsWith(uploadRoot)) {
			throw new IllegalArgumentException("Reference escapes upload directory: " + ref);
		}
		return path;
	}

	private static boolean isPlaceholder(String ref) {
		return ref == null || ref.isBlank() || TryOnSession.PENDING_REF.equals(ref);
	}
}
