package com.tryonai.backend.service.storage;

import com.tryonai.backend.config.properties.StorageProperties;
import com.tryonai.backend.enums.ArtifactKind;
import com.tryonai.backend.exception.InvalidInputException;
import org.apache.commons.io.FilenameUtils;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Locale;

/**
 * Name, type and size checks shared by both gateways.
 */
final class UploadValidator {

	private UploadValidator() {
	}

	static String validate(MultipartFile file, ArtifactKind kind, StorageProperties properties) {
		String label = kind.getTag();
		if (file == null || file.getOriginalFilename() == null || file.getOriginalFilename().isBlank()) {
			throw new InvalidInputException(InvalidInputException.Reason.INVALID_INPUT,
					"No filename provided for " + label + " image");
		}

		String extension = FilenameUtils.getExtension(file.getOriginalFilename()).toLowerCase(Locale.ROOT);
		List<String> allowed = properties.getAllowedExtensions();
		if (!allowed.contains(extension)) {
			throw new InvalidInputException(InvalidInputException.Reason.INVALID_INPUT,
					"Invalid file type. Allowed: " + String.join(", ", allowed));
		}

		if (file.isEmpty()) {
			throw new InvalidInputException(InvalidInputException.Reason.INVALID_INPUT,
					"Empty " + label + " image");
		}

		long maxBytes = properties.getMaxFileSize().toBytes();
		if (file.getSize() > maxBytes) {
			throw new InvalidInputException(InvalidInputException.Reason.TOO_LARGE,
					"File too large. Max: " + properties.getMaxFileSize().toMegabytes() + " MB");
		}
		return extension;
	}
}
