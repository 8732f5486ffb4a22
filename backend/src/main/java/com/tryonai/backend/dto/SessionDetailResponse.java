package com.tryonai.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tryonai.backend.enums.GarmentCategory;
import com.tryonai.backend.enums.SessionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionDetailResponse {
	private UUID id;
	private String userToken;
	private SessionStatus status;
	private GarmentCategory category;
	private String userImageUrl;
	private String garmentImageUrl;
	private String outputImageUrl;
	private String errorReason;
	private Instant createdAt;
	private Instant updatedAt;
	private Instant expiresAt;
}
