package com.tryonai.backend.service;

import com.tryonai.backend.config.properties.SessionProperties;
import com.tryonai.backend.entity.TryOnSession;
import com.tryonai.backend.enums.GarmentCategory;
import com.tryonai.backend.enums.SessionStatus;
import com.tryonai.backend.exception.IllegalTransitionException;
import com.tryonai.backend.repository.TryOnSessionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Data access for try-on sessions. Each method runs in its own single-row transaction
 * (or joins the caller's). Status changes go through {@link SessionStateMachine} and always
 * commit in a new transaction, also when issued from an after-commit callback.
 */
@Slf4j
@Service
public class SessionStore {

	private final TryOnSessionRepository sessionRepository;
	private final SessionStateMachine stateMachine;
	private final SessionProperties sessionProperties;
	private final Clock clock;
	private final TransactionTemplate transactionTemplate;

	public SessionStore(TryOnSessionRepository sessionRepository, SessionStateMachine stateMachine,
						SessionProperties sessionProperties, Clock clock, PlatformTransactionManager transactionManager) {
		this.sessionRepository = sessionRepository;
		this.stateMachine = stateMachine;
		this.sessionProperties = sessionProperties;
		this.clock = clock;
		this.transactionTemplate = new TransactionTemplate(transactionManager);
		this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
	}

	@Transactional
	public TryOnSession create(String ownerToken, GarmentCategory category) {
		Instant now = clock.instant();

		TryOnSession session = new TryOnSession();
		session.setOwnerToken(ownerToken);
		session.setCategory(category);
		session.setStatus(SessionStatus.CREATED);
		session.setSubjectImageRef(TryOnSession.PENDING_REF);
		session.setOverlayImageRef(TryOnSession.PENDING_REF);
		session.setCreatedAt(now);
		session.setUpdatedAt(now);
		session.setExpiresAt(now.plus(sessionProperties.getTtl()));

		TryOnSession saved = sessionRepository.save(session);
		log.debug("Created session {} for owner {}, expires at {}", saved.getId(), ownerToken, saved.getExpiresAt());
		return saved;
	}

	/**
	 * Writes the input references. Only allowed while the session is still CREATED.
	 *
	 * @return the updated session, or empty if it no longer exists or already left CREATED
	 */
	@Transactional
	public Optional<TryOnSession> attachInputs(UUID id, String subjectRef, String overlayRef) {
		Optional<TryOnSession> found = sessionRepository.findById(id);
		if (found.isEmpty()) {
			return Optional.empty();
		}
		TryOnSession session = found.get();
		if (session.getStatus() != SessionStatus.CREATED) {
			log.warn("Refusing to attach inputs to session {} in status {}", id, session.getStatus());
			return Optional.empty();
		}
		session.setSubjectImageRef(subjectRef);
		session.setOverlayImageRef(overlayRef);
		session.setUpdatedAt(clock.instant());
		return Optional.of(sessionRepository.save(session));
	}

	@Transactional(readOnly = true)
	public Optional<TryOnSession> get(UUID id) {
		return sessionRepository.findById(id);
	}

	@Transactional(readOnly = true)
	public List<TryOnSession> listByOwner(String ownerToken, int limit) {
		return sessionRepository.findByOwnerTokenOrderByCreatedAtDesc(ownerToken, PageRequest.of(0, limit));
	}

	public StatusUpdateResult updateStatus(UUID id, SessionStatus newStatus) {
		return updateStatus(id, newStatus, null, null);
	}

	/**
	 * Applies a status transition to an existing row. Never inserts and never throws for
	 * a missing row or an illegal edge.
	 */
	public StatusUpdateResult updateStatus(UUID id, SessionStatus newStatus, String outputRef, String errorReason) {
		try {
			StatusUpdateResult result = transactionTemplate.execute(tx -> applyTransition(id, newStatus, outputRef, errorReason));
			return result != null ? result : StatusUpdateResult.notFound();
		} catch (OptimisticLockingFailureException e) {
			// row deleted between read and flush
			log.debug("Session {} vanished while updating to {}", id, newStatus);
			return StatusUpdateResult.notFound();
		}
	}

	private StatusUpdateResult applyTransition(UUID id, SessionStatus newStatus, String outputRef, String errorReason) {
		Optional<TryOnSession> found = sessionRepository.findById(id);
		if (found.isEmpty()) {
			log.debug("Status update {} for session {} skipped: not found", newStatus, id);
			return StatusUpdateResult.notFound();
		}

		TryOnSession session = found.get();
		try {
			stateMachine.apply(session, newStatus, outputRef, errorReason, clock.instant());
		} catch (IllegalTransitionException e) {
			log.warn("Session {}: {}", id, e.getMessage());
			return StatusUpdateResult.illegalTransition(session, e.getMessage());
		}
		return StatusUpdateResult.updated(sessionRepository.saveAndFlush(session));
	}

	/**
	 * Sessions whose expiry is strictly before {@code now}, oldest expiry first.
	 */
	@Transactional(readOnly = true)
	public List<TryOnSession> listExpired(Instant now, int limit) {
		return sessionRepository.findByExpiresAtBeforeOrderByExpiresAtAsc(now, PageRequest.of(0, limit));
	}

	@Transactional(readOnly = true)
	public List<TryOnSession> listPending(int limit) {
		return sessionRepository.findByStatusOrderByCreatedAtAsc(SessionStatus.CREATED, PageRequest.of(0, limit));
	}

	/**
	 * @return {@code true} if a row was removed, {@code false} if it was already gone
	 */
	@Transactional
	public boolean delete(UUID id) {
		return sessionRepository.deleteSessionById(id) > 0;
	}

	@Transactional(readOnly = true)
	public long count() {
		return sessionRepository.count();
	}
}
