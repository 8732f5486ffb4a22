package com.tryonai.backend.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
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
@ConfigurationProperties(prefix = "app.session")
public class SessionProperties {

	/**
	 * Fixed lifespan of a session, counted from creation. Never extended.
	 */
	@NotNull
	private Duration ttl = Duration.ofHours(24);

	@Valid
	private Reaper reaper = new Reaper();

	@Valid
	private Dispatcher dispatcher = new Dispatcher();

	@AssertTrue(message = "app.session.ttl must be positive")
	public boolean isTtlPositive() {
		return ttl != null && !ttl.isNegative() && !ttl.isZero();
	}

	@Getter
	@Setter
	public static class Reaper {
		private boolean enabled = true;

		@Min(1)
		private long intervalMs = 3_600_000L;

		@Min(0)
		private long initialDelayMs = 60_000L;

		/**
		 * Upper bound on expired sessions fetched and removed per sweep.
		 */
		@Min(1)
		private int batchSize = 100;
	}

	@Getter
	@Setter
	public static class Dispatcher {
		@Min(1)
		private int corePoolSize = 4;

		@Min(1)
		private int maxPoolSize = 8;

		@Min(0)
		private int queueCapacity = 100;

		@Min(16)
		@Max(1024)
		private int errorDetailMaxLength = 500;
	}
}
