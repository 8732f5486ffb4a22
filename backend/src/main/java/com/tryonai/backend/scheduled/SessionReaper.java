package com.tryonai.backend.scheduled;

import com.tryonai.backend.config.properties.SessionProperties;
import com.tryonai.backend.entity.TryOnSession;
import com.tryonai.backend.service.SessionStore;
import com.tryonai.backend.service.storage.StorageGateway;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.stream.Stream;

/**
 * Periodically removes expired sessions together with their artifacts.
 * <p>
 * Artifacts are deleted before the row, so an interrupted sweep leaves a row that the
 * next sweep picks up again rather than a row pointing at nothing. Processing status is
 * not consulted: a session still PROCESSING when it expires is removed as well.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionReaper {

	private final SessionStore sessionStore;
	private final StorageGateway storageGateway;
	private final SessionProperties sessionProperties;
	private final Clock clock;

	private volatile boolean stopping;

	@Scheduled(fixedDelayString = "${app.session.reaper.interval-ms:3600000}",
			initialDelayString = "${app.session.reaper.initial-delay-ms:60000}")
	public void scheduledSweep() {
		if (!sessionProperties.getReaper().isEnabled()) {
			log.debug("Session reaper disabled");
			return;
		}
		try {
			sweep();
		} catch (Exception e) {
			log.error("Cleanup error", e);
		}
	}

	/**
	 * Runs one pass over at most {@code batch-size} expired sessions.
	 *
	 * @return number of sessions removed
	 */
	public int sweep() {
		if (stopping) {
			return 0;
		}

		List<TryOnSession> expired = sessionStore.listExpired(clock.instant(), sessionProperties.getReaper().getBatchSize());
		if (expired.isEmpty()) {
			log.debug("No expired sessions");
			return 0;
		}

		log.info("Cleaning up {} expired session(s)", expired.size());
		int removed = 0;
		for (TryOnSession session : expired) {
			if (stopping) {
				log.info("Shutdown requested, stopping sweep after {} session(s)", removed);
				break;
			}
			try {
				if (reap(session)) {
					removed++;
				}
			} catch (Exception e) {
				log.error("Failed to remove expired session {}: {}", session.getId(), e.getMessage(), e);
			}
		}
		log.info("Sweep finished, removed {} of {} expired session(s)", removed, expired.size());
		return removed;
	}

	/**
	 * Deletes artifacts, then the row. If an artifact cannot be deleted the exception
	 * propagates and the row is kept for the next sweep.
	 */
	private boolean reap(TryOnSession session) {
		Stream.of(session.getSubjectImageRef(), session.getOverlayImageRef(), session.getOutputImageRef())
				.forEach(storageGateway::delete);
		boolean deleted = sessionStore.delete(session.getId());
		if (deleted) {
			log.info("Removed expired session {} (status {}, expired at {})",
					session.getId(), session.getStatus(), session.getExpiresAt());
		}
		return deleted;
	}

	@PreDestroy
	public void stop() {
		stopping = true;
		log.info("Session reaper stopping");
	}

	public boolean isStopping() {
		return stopping;
	}
}
