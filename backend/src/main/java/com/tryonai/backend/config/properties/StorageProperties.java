package com.tryonai.backend.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Validated
@Configuration
@ConfigurationProperties(prefix = "app.storage")
public class StorageProperties {

	/**
	 * Backing store for artifacts: {@code local} or {@code s3}.
	 */
	@NotBlank
	private String type = "local";

	@NotBlank
	private String uploadDir = "./uploads";

	private DataSize maxFileSize = DataSize.ofMegabytes(10);

	@NotEmpty
	private List<String> allowedExtensions = new ArrayList<>(List.of("jpg", "jpeg", "png", "webp"));
}
