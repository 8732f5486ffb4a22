package com.tryonai.backend.service.storage;

import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Checks that stored bytes decode as an image of the declared type. WEBP has no
 * ImageIO reader in the JDK, so only its RIFF container header is checked.
 */
@Slf4j
final class ImageVerifier {

	private static final byte[] RIFF = "RIFF".getBytes(StandardCharsets.US_ASCII);
	private static final byte[] WEBP = "WEBP".getBytes(StandardCharsets.US_ASCII);

	private ImageVerifier() {
	}

	static boolean isValidImage(InputStream in, String extension) {
		try {
			if ("webp".equals(extension)) {
				byte[] header = in.readNBytes(12);
				return header.length == 12
						&& Arrays.equals(Arrays.copyOfRange(header, 0, 4), RIFF)
						&& Arrays.equals(Arrays.copyOfRange(header, 8, 12), WEBP);
			}
			BufferedImage image = ImageIO.read(in);
			return image != null && image.getWidth() > 0 && image.getHeight() > 0;
		} catch (IOException | RuntimeException e) {
			log.debug("Image decode failed: {}", e.getMessage());
			return false;
		}
	}
}
