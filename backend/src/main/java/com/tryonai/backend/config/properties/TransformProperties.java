package com.tryonai.backend.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Getter
@Setter
@Validated
@Configuration
@ConfigurationProperties(prefix = "app.transform")
public class TransformProperties {

	private Stub stub = new Stub();

	@Getter
	@Setter
	public static class Stub {
		/**
		 * Simulated model latency.
		 */
		private Duration delay = Duration.ofSeconds(3);

		@DecimalMin("0.0")
		@DecimalMax("1.0")
		private double failureRate = 0.1;
	}
}
