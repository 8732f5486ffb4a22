package com.tryonai.backend.listener;

import com.tryonai.backend.worker.SessionDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Hands a new session to the dispatcher once the intake transaction has committed, so the
 * worker never reads a row (or input refs) that are not yet visible.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionCreatedListener {

	private final SessionDispatcher sessionDispatcher;

	@TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
	public void onSessionCreated(SessionCreatedEvent event) {
		log.info("Transaction committed for session: {}. Submitting to dispatcher.", event.getSessionId());
		sessionDispatcher.submit(event.getSessionId());
	}
}
