package com.tryonai.backend.worker;

import com.tryonai.backend.config.AsyncConfig;
import com.tryonai.backend.entity.TryOnSession;
import com.tryonai.backend.enums.SessionStatus;
import com.tryonai.backend.exception.TransformException;
import com.tryonai.backend.service.SessionStore;
import com.tryonai.backend.service.StatusUpdateResult;
import com.tryonai.backend.service.storage.StorageGateway;
import com.tryonai.backend.service.transform.TransformClient;
import com.tryonai.backend.service.transform.TransformRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs the processing pipeline for a session on the bounded dispatch pool:
 * load, CREATED -> PROCESSING, transform, then COMPLETED or FAILED.
 * <p>
 * Nothing thrown by a single session escapes {@link #process(UUID)}. A row that
 * disappears mid-pipeline (reaped) makes the remaining status writes no-ops.
 */
@Slf4j
@Component
public class SessionDispatcher {

	static final String INTERNAL_FAILURE = "Processing failed due to an internal error";
	static final String BUSY_FAILURE = "Server is busy, please try again later";

	private final SessionStore sessionStore;
	private final StorageGateway storageGateway;
	private final TransformClient transformClient;
	private final TaskExecutor executor;

	public SessionDispatcher(SessionStore sessionStore, StorageGateway storageGateway, TransformClient transformClient,
							 @Qualifier(AsyncConfig.SESSION_DISPATCH_EXECUTOR) TaskExecutor executor) {
		this.sessionStore = sessionStore;
		this.storageGateway = storageGateway;
		this.transformClient = transformClient;
		this.executor = executor;
	}

	/**
	 * Schedules one execution of the pipeline for {@code sessionId}. Concurrent submits for
	 * the same id are not deduplicated here; the second run stops at the PROCESSING transition.
	 */
	public void submit(UUID sessionId) {
		try {
			executor.execute(() -> process(sessionId));
			log.debug("Session {} queued for processing", sessionId);
		} catch (TaskRejectedException e) {
			log.error("Dispatch pool saturated, rejecting session {}", sessionId);
			rejectSession(sessionId);
		}
	}

	void process(UUID sessionId) {
		log.info("STARTING processing for session: {}", sessionId);

		Optional<TryOnSession> loaded;
		try {
			loaded = sessionStore.get(sessionId);
		} catch (RuntimeException e) {
			log.error("Could not load session {}: {}", sessionId, e.getMessage(), e);
			return;
		}
		if (loaded.isEmpty()) {
			log.debug("Session {} not found, nothing to process", sessionId);
			return;
		}

		StatusUpdateResult started;
		try {
			started = sessionStore.updateStatus(sessionId, SessionStatus.PROCESSING);
		} catch (RuntimeException e) {
			log.error("Could not mark session {} as processing: {}", sessionId, e.getMessage(), e);
			return;
		}
		if (!started.isUpdated()) {
			if (started.getOutcome() == StatusUpdateResult.Outcome.ILLEGAL_TRANSITION) {
				log.warn("Session {} not processed: {}", sessionId, started.getDetail());
			} else {
				log.debug("Session {} vanished before processing started", sessionId);
			}
			return;
		}

		TryOnSession session = started.getSession();
		Path outputFile = null;
		String outputRef = null;
		try {
			outputFile = transformClient.run(TransformRequest.builder()
					.sessionId(sessionId)
					.subjectImageRef(session.getSubjectImageRef())
					.overlayImageRef(session.getOverlayImageRef())
					.category(session.getCategory())
					.build());

			outputRef = storageGateway.saveOutput(sessionId, outputFile);
			StatusUpdateResult completed = sessionStore.updateStatus(sessionId, SessionStatus.COMPLETED, outputRef, null);
			if (completed.isUpdated()) {
				log.info("SUCCESSFULLY processed session: {}", sessionId);
			} else {
				log.warn("Session {} could not be completed ({}), discarding output", sessionId, completed.getOutcome());
				discardOutput(sessionId, outputRef);
			}
		} catch (TransformException e) {
			log.warn("FAILED to process session: {}. Reason: {}", sessionId, e.getMessage());
			markFailed(sessionId, e.getMessage());
		} catch (Exception e) {
			log.error("FAILED to process session: {}", sessionId, e);
			if (outputRef != null) {
				discardOutput(sessionId, outputRef);
			}
			markFailed(sessionId, INTERNAL_FAILURE);
		} finally {
			if (outputFile != null) {
				FileUtils.deleteQuietly(outputFile.toFile());
			}
		}
	}

	private void rejectSession(UUID sessionId) {
		try {
			// FAILED is only reachable through PROCESSING
			if (sessionStore.updateStatus(sessionId, SessionStatus.PROCESSING).isUpdated()) {
				markFailed(sessionId, BUSY_FAILURE);
			}
		} catch (RuntimeException e) {
			log.error("Could not reject session {}: {}", sessionId, e.getMessage(), e);
		}
	}

	private void discardOutput(UUID sessionId, String outputRef) {
		try {
			storageGateway.delete(outputRef);
		} catch (RuntimeException e) {
			log.error("Could not discard output {} of session {}: {}", outputRef, sessionId, e.getMessage(), e);
		}
	}

	private void markFailed(UUID sessionId, String errorReason) {
		try {
			StatusUpdateResult failed = sessionStore.updateStatus(sessionId, SessionStatus.FAILED, null, errorReason);
			if (!failed.isUpdated()) {
				log.debug("Session {} not marked failed: {}", sessionId, failed.getOutcome());
			}
		} catch (RuntimeException e) {
			log.error("Could not mark session {} as failed: {}", sessionId, e.getMessage(), e);
		}
	}
}
