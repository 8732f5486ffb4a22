package com.tryonai.backend.service;

import com.tryonai.backend.dto.SessionCreatedResponse;
import com.tryonai.backend.dto.SessionDetailResponse;
import com.tryonai.backend.dto.SessionStatusResponse;
import com.tryonai.backend.entity.TryOnSession;
import com.tryonai.backend.enums.ArtifactKind;
import com.tryonai.backend.enums.GarmentCategory;
import com.tryonai.backend.enums.SessionStatus;
import com.tryonai.backend.exception.InvalidInputException;
import com.tryonai.backend.exception.SessionNotFoundException;
import com.tryonai.backend.service.storage.StorageGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class TryOnSessionServiceImpl implements TryOnSessionService {

	static final int MAX_TOKEN_LENGTH = 255;
	static final int MAX_LIST_LIMIT = 50;

	private static final Map<SessionStatus, String> PROGRESS_MESSAGES = new EnumMap<>(Map.of(
			SessionStatus.CREATED, "Session created, queued for processing...",
			SessionStatus.PROCESSING, "AI model is generating your try-on, this takes 1-2 minutes...",
			SessionStatus.COMPLETED, "Try-on completed successfully!",
			SessionStatus.FAILED, "Processing failed. Please try again."
	));

	private final SessionStore sessionStore;
	private final StorageGateway storageGateway;
	private final SessionEventPublisher sessionEventPublisher;

	/**
	 * Creates the row, stores both images and attaches them. Any failure rolls the row back
	 * and removes images already written; dispatch happens only after commit.
	 */
	@Override
	@Transactional
	public SessionCreatedResponse createSession(MultipartFile userImage, MultipartFile garmentImage, String userToken, String category) {
		if (!StringUtils.hasText(userToken) || userToken.length() > MAX_TOKEN_LENGTH) {
			throw new InvalidInputException(InvalidInputException.Reason.INVALID_INPUT,
					"user_token must be between 1 and " + MAX_TOKEN_LENGTH + " characters");
		}
		GarmentCategory garmentCategory = GarmentCategory.fromValue(
				StringUtils.hasText(category) ? category : GarmentCategory.DEFAULT_VALUE);
		storageGateway.validate(userImage, ArtifactKind.SUBJECT);
		storageGateway.validate(garmentImage, ArtifactKind.OVERLAY);

		TryOnSession session = sessionStore.create(userToken, garmentCategory);
		UUID sessionId = session.getId();

		List<String> savedRefs = new ArrayList<>();
		try {
			String subjectRef = storageGateway.validateAndSave(sessionId, userImage, ArtifactKind.SUBJECT);
			savedRefs.add(subjectRef);
			String overlayRef = storageGateway.validateAndSave(sessionId, garmentImage, ArtifactKind.OVERLAY);
			savedRefs.add(overlayRef);

			sessionStore.attachInputs(sessionId, subjectRef, overlayRef)
					.orElseThrow(() -> new IllegalStateException("Session " + sessionId + " disappeared during intake"));
		} catch (RuntimeException e) {
			savedRefs.forEach(this::discardQuietly);
			throw e;
		}

		sessionEventPublisher.publishSessionCreatedEvent(sessionId);
		log.info("Session {} created for user {}", sessionId, userToken);

		return SessionCreatedResponse.builder()
				.sessionId(sessionId)
				.status("created")
				.message("Session created. Processing started.")
				.build();
	}

	@Override
	public SessionStatusResponse getSessionStatus(UUID sessionId, String baseUrl) {
		TryOnSession session = sessionStore.get(sessionId)
				.orElseThrow(() -> new SessionNotFoundException(sessionId));
		return toStatusResponse(session, baseUrl);
	}

	@Override
	public SessionDetailResponse getSessionDetails(UUID sessionId, String baseUrl) {
		TryOnSession session = sessionStore.get(sessionId)
				.orElseThrow(() -> new SessionNotFoundException(sessionId));

		return SessionDetailResponse.builder()
				.id(session.getId())
				.userToken(session.getOwnerToken())
				.status(session.getStatus())
				.category(session.getCategory())
				.userImageUrl(publicUrl(session.getSubjectImageRef(), baseUrl))
				.garmentImageUrl(publicUrl(session.getOverlayImageRef(), baseUrl))
				.outputImageUrl(publicUrl(session.getOutputImageRef(), baseUrl))
				.errorReason(session.getErrorReason())
				.createdAt(session.getCreatedAt())
				.updatedAt(session.getUpdatedAt())
				.expiresAt(session.getExpiresAt())
				.build();
	}

	@Override
	public List<SessionStatusResponse> listSessions(String userToken, int limit, String baseUrl) {
		if (!StringUtils.hasText(userToken)) {
			throw new InvalidInputException(InvalidInputException.Reason.INVALID_INPUT, "user_token is required");
		}
		int boundedLimit = Math.max(1, Math.min(limit, MAX_LIST_LIMIT));
		return sessionStore.listByOwner(userToken, boundedLimit).stream()
				.map(session -> toStatusResponse(session, baseUrl))
				.toList();
	}

	private SessionStatusResponse toStatusResponse(TryOnSession session, String baseUrl) {
		return SessionStatusResponse.builder()
				.id(session.getId())
				.status(session.getStatus())
				.outputImageUrl(publicUrl(session.getOutputImageRef(), baseUrl))
				.errorReason(session.getErrorReason())
				.progressMessage(PROGRESS_MESSAGES.get(session.getStatus()))
				.build();
	}

	/**
	 * Local refs are served relative to the API host; anything else is resolved by the gateway.
	 */
	String publicUrl(String ref, String baseUrl) {
		if (!StringUtils.hasText(ref) || TryOnSession.PENDING_REF.equals(ref)) {
			return null;
		}
		if (ref.startsWith("http://") || ref.startsWith("https://")) {
			return ref;
		}
		if (ref.startsWith("/")) {
			String base = baseUrl == null ? "" : baseUrl.replaceAll("/+$", "");
			if (base.endsWith("/api")) {
				base = base.substring(0, base.length() - 4);
			}
			return base + ref;
		}
		return storageGateway.resolve(ref).toString();
	}

	private void discardQuietly(String ref) {
		try {
			storageGateway.delete(ref);
		} catch (RuntimeException e) {
			log.warn("Could not remove artifact {} after failed intake: {}", ref, e.getMessage());
		}
	}
}
