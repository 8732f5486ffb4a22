package com.tryonai.backend.entity;

import com.tryonai.backend.enums.GarmentCategory;
import com.tryonai.backend.enums.SessionStatus;
import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "tryon_sessions", indexes = {
		@Index(name = "idx_user_token", columnList = "user_token"),
		@Index(name = "idx_status_created", columnList = "status, created_at"),
		@Index(name = "idx_expires_status", columnList = "expires_at, status")
})
@Data
public class TryOnSession {

	public static final String PENDING_REF = "pending";

	@Id
	@GeneratedValue(strategy = GenerationType.UUID)
	private UUID id;

	@Column(name = "user_token", nullable = false, updatable = false, length = 255)
	private String ownerToken;

	@Column(name = "user_image_url", nullable = false, length = 1024)
	private String subjectImageRef;

	@Column(name = "garment_image_url", nullable = false, length = 1024)
	private String overlayImageRef;

	@Column(name = "output_image_url", length = 1024)
	private String outputImageRef;

	@Enumerated(EnumType.STRING)
	@Column(name = "garment_category", nullable = false, updatable = false, length = 20)
	private GarmentCategory category;

	@Enumerated(EnumType.STRING)
	@Column(nullable = false, length = 20)
	private SessionStatus status;

	@Column(name = "error_reason", length = 1024)
	private String errorReason;

	@Column(name = "created_at", nullable = false, updatable = false)
	private Instant createdAt;

	@Column(name = "updated_at", nullable = false)
	private Instant updatedAt;

	@Column(name = "expires_at", nullable = false, updatable = false)
	private Instant expiresAt;

	public boolean hasInputsAttached() {
		return !PENDING_REF.equals(subjectImageRef) && !PENDING_REF.equals(overlayImageRef);
	}
}
