package com.tryonai.backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * S3 clients, only created when artifacts are stored in S3. Credentials come from the
 * default AWS provider chain.
 */
@Configuration
@ConditionalOnProperty(prefix = "app.storage", name = "type", havingValue = "s3")
public class S3Config {

	@Value("${aws.region}")
	private String region;

	@Bean(destroyMethod = "close")
	public S3Client s3Client() {
		return S3Client.builder()
				.region(Region.of(region))
				.build();
	}

	@Bean(destroyMethod = "close")
	public S3Presigner s3Presigner() {
		return S3Presigner.builder()
				.region(Region.of(region))
				.build();
	}
}
