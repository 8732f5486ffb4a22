package com.tryonai.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class TryOnAiApplication {

	public static void main(String[] args) {
		SpringApplication.run(TryOnAiApplication.class, args);
	}
}
