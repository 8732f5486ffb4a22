package com.tryonai.backend.service;

import com.tryonai.backend.dto.SessionCreatedResponse;
import com.tryonai.backend.dto.SessionDetailResponse;
import com.tryonai.backend.dto.SessionStatusResponse;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.UUID;

public interface TryOnSessionService {
	SessionCreatedResponse createSession(MultipartFile userImage, MultipartFile garmentImage, String userToken, String category);

	SessionStatusResponse getSessionStatus(UUID sessionId, String baseUrl);

	SessionDetailResponse getSessionDetails(UUID sessionId, String baseUrl);

	List<SessionStatusResponse> listSessions(String userToken, int limit, String baseUrl);
}
