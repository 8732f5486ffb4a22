package com.tryonai.backend.service.storage;

import com.tryonai.backend.config.properties.StorageProperties;
import com.tryonai.backend.entity.TryOnSession;
import com.tryonai.backend.enums.ArtifactKind;
import com.tryonai.backend.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.UUID;

/**
 * Keeps artifacts in an S3 bucket. References are object keys such as
 * {@code users/<sessionId>_user.jpg}.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "app.storage", name = "type", havingValue = "s3")
public class S3StorageGateway implements StorageGateway {

	private static final Duration PRESIGN_DURATION = Duration.ofMinutes(15);

	private final S3Client s3Client;
	private final S3Presigner s3Presigner;
	private final StorageProperties storageProperties;
	private final String bucketName;

	public S3StorageGateway(S3Client s3Client, S3Presigner s3Presigner, StorageProperties storageProperties,
							@Value("${aws.s3.bucket-name}") String bucketName) {
		this.s3Client = s3Client;
		this.s3Presigner = s3Presigner;
		this.storageProperties = storageProperties;
		this.bucketName = bucketName;
	}

	@Override
	public String validate(MultipartFile file, ArtifactKind kind) {
		return UploadValidator.validate(file, kind, storageProperties);
	}

	@Override
	public String validateAndSave(UUID sessionId, MultipartFile file, ArtifactKind kind) {
		String extension = validate(file, kind);

		byte[] data;
		try {
			data = file.getBytes();
		} catch (IOException e) {
			throw new InvalidInputException(InvalidInputException.Reason.INVALID_INPUT,
					"Could not read " + kind.getTag() + " image", e);
		}
		if (!ImageVerifier.isValidImage(new ByteArrayInputStream(data), extension)) {
			throw new InvalidInputException(InvalidInputException.Reason.CORRUPT_IMAGE,
					"Error processing " + kind.getTag() + " image: file is not a valid image");
		}

		String key = kind.getFolder() + "/" + sessionId + "_" + kind.getTag() + "." + extension;
		PutObjectRequest putObjectRequest = PutObjectRequest.builder()
				.bucket(bucketName)
				.key(key)
				.contentType(file.getContentType() != null ? file.getContentType() : contentType(extension))
				.build();

		try {
			s3Client.putObject(putObjectRequest, RequestBody.fromBytes(data));
			log.info("Uploaded {} image {} to S3 bucket {}", kind.getTag(), key, bucketName);
			return key;
		} catch (S3Exception e) {
			log.error("Error uploading {} image to S3: {}", kind.getTag(), e.getMessage());
			throw new IllegalStateException("Failed to upload " + kind.getTag() + " image to S3", e);
		}
	}

	@Override
	public String saveOutput(UUID sessionId, Path source) throws IOException {
		String extension = FilenameUtils.getExtension(source.getFileName().toString()).toLowerCase(Locale.ROOT);
		if (extension.isEmpty()) {
			extension = "png";
		}
		String key = ArtifactKind.OUTPUT.getFolder() + "/" + sessionId + "_" + ArtifactKind.OUTPUT.getTag() + "." + extension;

		PutObjectRequest putObjectRequest = PutObjectRequest.builder()
				.bucket(bucketName)
				.key(key)
				.contentType(contentType(extension))
				.build();
		try {
			s3Client.putObject(putObjectRequest, RequestBody.fromFile(source));
			log.info("Uploaded output {} for session {} to S3 bucket {}", key, sessionId, bucketName);
			return key;
		} catch (S3Exception e) {
			throw new IOException("Failed to upload output to S3", e);
		}
	}

	@Override
	public InputStream openStream(String ref) throws IOException {
		GetObjectRequest getObjectRequest = GetObjectRequest.builder()
				.bucket(bucketName)
				.key(ref)
				.build();
		try {
			return s3Client.getObject(getObjectRequest);
		} catch (S3Exception e) {
			throw new IOException("Failed to download " + ref + " from S3", e);
		}
	}

	@Override
	public URI resolve(String ref) {
		GetObjectRequest getObjectRequest = GetObjectRequest.builder()
				.bucket(bucketName)
				.key(ref)
				.build();

		GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
				.signatureDuration(PRESIGN_DURATION)
				.getObjectRequest(getObjectRequest)
				.build();

		PresignedGetObjectRequest presignedRequest = s3Presigner.presignGetObject(presignRequest);
		try {
			return presignedRequest.url().toURI();
		} catch (URISyntaxException e) {
			throw new IllegalStateException("Presigned URL is not a valid URI for key " + ref, e);
		}
	}

	@Override
	public boolean exists(String ref) {
		if (isPlaceholder(ref)) {
			return false;
		}
		try {
			s3Client.headObject(HeadObjectRequest.builder().bucket(bucketName).key(ref).build());
			return true;
		} catch (NoSuchKeyException e) {
			return false;
		} catch (S3Exception e) {
			if (e.statusCode() == 404) {
				return false;
			}
			throw e;
		}
	}

	@Override
	public boolean delete(String ref) {
		if (isPlaceholder(ref)) {
			return false;
		}
		if (!exists(ref)) {
			return false;
		}
		s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucketName).key(ref).build());
		log.info("Deleted S3 object {} from bucket {}", ref, bucketName);
		return true;
	}

	@Override
	public String type() {
		return "s3";
	}

	private static String contentType(String extension) {
		return switch (extension) {
			case "png" -> "image/png";
			case "webp" -> "image/webp";
			default -> "image/jpeg";
		};
	}

	private static boolean isPlaceholder(String ref) {
		return ref == null || ref.isBlank() || TryOnSession.PENDING_REF.equals(ref);
	}
}
