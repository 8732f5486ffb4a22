package com.tryonai.backend.controller;

import com.tryonai.backend.dto.SessionCreatedResponse;
import com.tryonai.backend.dto.SessionDetailResponse;
import com.tryonai.backend.dto.SessionStatusResponse;
import com.tryonai.backend.enums.GarmentCategory;
import com.tryonai.backend.service.TryOnSessionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/tryon/sessions")
@RequiredArgsConstructor
public class TryOnSessionController {

	private final TryOnSessionService tryOnSessionService;

	@PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
	public ResponseEntity<SessionCreatedResponse> createSession(
			@RequestPart("user_image") MultipartFile userImage,
			@RequestPart("garment_image") MultipartFile garmentImage,
			@RequestParam("user_token") String userToken,
			@RequestParam(value = "category", defaultValue = GarmentCategory.DEFAULT_VALUE) String category) {

		SessionCreatedResponse response = tryOnSessionService.createSession(userImage, garmentImage, userToken, category);
		return new ResponseEntity<>(response, HttpStatus.CREATED);
	}

	@GetMapping("/{sessionId}")
	public ResponseEntity<SessionStatusResponse> getSessionStatus(@PathVariable UUID sessionId) {
		return ResponseEntity.ok(tryOnSessionService.getSessionStatus(sessionId, baseUrl()));
	}

	@GetMapping("/{sessionId}/details")
	public ResponseEntity<SessionDetailResponse> getSessionDetails(@PathVariable UUID sessionId) {
		return ResponseEntity.ok(tryOnSessionService.getSessionDetails(sessionId, baseUrl()));
	}

	@GetMapping
	public ResponseEntity<List<SessionStatusResponse>> listSessions(
			@RequestParam("user_token") String userToken,
			@RequestParam(value = "limit", defaultValue = "10") int limit) {
		return ResponseEntity.ok(tryOnSessionService.listSessions(userToken, limit, baseUrl()));
	}

	private static String baseUrl() {
		return ServletUriComponentsBuilder.fromCurrentContextPath().toUriString();
	}
}
