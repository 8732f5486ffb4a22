package com.tryonai.backend.service.storage;

import com.tryonai.backend.enums.ArtifactKind;
import com.tryonai.backend.exception.InvalidInputException;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Stores the image artifacts referenced by a session. References are opaque strings
 * produced by the gateway itself; callers never build them.
 */
public interface StorageGateway {

	/**
	 * Checks file name, extension and size without storing anything.
	 *
	 * @return the normalized (lower case) extension
	 * @throws InvalidInputException with reason INVALID_INPUT or TOO_LARGE
	 */
	String validate(MultipartFile file, ArtifactKind kind);

	/**
	 * Validates, stores and verifies an uploaded image.
	 *
	 * @throws InvalidInputException when the upload is rejected; nothing is left behind
	 */
	String validateAndSave(UUID sessionId, MultipartFile file, ArtifactKind kind);

	/**
	 * Copies a produced output image into storage.
	 */
	String saveOutput(UUID sessionId, Path source) throws IOException;

	InputStream openStream(String ref) throws IOException;

	/**
	 * Absolute location of the artifact: a file URI for local storage, a presigned URL for S3.
	 */
	URI resolve(String ref);

	boolean exists(String ref);

	/**
	 * Idempotent. A missing artifact, a {@code null} ref or the {@code pending} placeholder is not an error.
	 *
	 * @return {@code true} if something was removed
	 */
	boolean delete(String ref);

	/**
	 * Short name of the backing store, for diagnostics.
	 */
	String type();
}
