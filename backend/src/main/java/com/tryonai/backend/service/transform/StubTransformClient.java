package com.tryonai.backend.service.transform;

import com.tryonai.backend.config.properties.TransformProperties;
import com.tryonai.backend.exception.TransformException;
import com.tryonai.backend.service.storage.StorageGateway;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Stand-in for the try-on model: waits for the configured delay, fails at the configured
 * rate with one of a few canned errors, and otherwise returns a copy of the subject image.
 */
@Slf4j
@Component
public class StubTransformClient implements TransformClient {

	static final List<String> MOCK_ERRORS = List.of(
			"Unable to detect person in image",
			"Image quality too low",
			"Processing timeout",
			"Invalid pose detected"
	);

	private final StorageGateway storageGateway;
	private final TransformProperties transformProperties;
	private final Supplier<Random> random;

	public StubTransformClient(StorageGateway storageGateway, TransformProperties transformProperties) {
		this(storageGateway, transformProperties, ThreadLocalRandom::current);
	}

	StubTransformClient(StorageGateway storageGateway, TransformProperties transformProperties, Supplier<Random> random) {
		this.storageGateway = storageGateway;
		this.transformProperties = transformProperties;
		this.random = random;
	}

	@Override
	public Path run(TransformRequest request) throws TransformException {
		TransformProperties.Stub stub = transformProperties.getStub();
		log.info("Stub transform for session {} ({}), delay {}", request.getSessionId(), request.getCategory().getValue(), stub.getDelay());

		try {
			Thread.sleep(stub.getDelay().toMillis());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new TransformException("Processing was interrupted", e);
		}

		if (random.get().nextDouble() < stub.getFailureRate()) {
			String error = MOCK_ERRORS.get(random.get().nextInt(MOCK_ERRORS.size()));
			log.warn("Session {} failed (stub): {}", request.getSessionId(), error);
			throw new TransformException(error);
		}

		String extension = FilenameUtils.getExtension(request.getSubjectImageRef());
		Path output = null;
		try (InputStream subject = storageGateway.openStream(request.getSubjectImageRef())) {
			output = Files.createTempFile("tryon-out-", "." + (extension.isEmpty() ? "png" : extension));
			Files.copy(subject, output, StandardCopyOption.REPLACE_EXISTING);
			return output;
		} catch (IOException e) {
			if (output != null) {
				FileUtils.deleteQuietly(output.toFile());
			}
			throw new TransformException("Could not read the uploaded photo", e);
		}
	}
}
