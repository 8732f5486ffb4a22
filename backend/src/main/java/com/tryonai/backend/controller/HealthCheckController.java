package com.tryonai.backend.controller;

import com.tryonai.backend.service.SessionStore;
import com.tryonai.backend.service.storage.StorageGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthCheckController {

	private final SessionStore sessionStore;
	private final StorageGateway storageGateway;

	@GetMapping
	public ResponseEntity<Map<String, String>> checkHealth() {
		try {
			long sessionCount = sessionStore.count();
			Map<String, String> response = Map.of(
					"status", "healthy",
					"db_connection", "OK",
					"sessions", String.valueOf(sessionCount),
					"storage", storageGateway.type()
			);
			return ResponseEntity.ok(response);
		} catch (Exception e) {
			log.warn("Health check failed: {}", e.getMessage(), e);
			Map<String, String> response = Map.of(
					"status", "degraded",
					"db_connection", "UNAVAILABLE",
					"storage", storageGateway.type()
			);
			return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
		}
	}
}
