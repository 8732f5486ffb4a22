package com.tryonai.backend.service;

import com.tryonai.backend.config.properties.SessionProperties;
import com.tryonai.backend.entity.TryOnSession;
import com.tryonai.backend.enums.SessionStatus;
import com.tryonai.backend.exception.IllegalTransitionException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Instant;

/**
 * Single place where a session's status, output reference and error reason are written.
 * Does not touch storage; the caller persists the mutated entity.
 */
@Component
@RequiredArgsConstructor
public class SessionStateMachine {

	public static final String GENERIC_FAILURE = "Processing failed. Please try again.";

	private final SessionProperties sessionProperties;

	/**
	 * Moves {@code session} to {@code target}.
	 *
	 * @param outputRef   required when {@code target} is COMPLETED, ignored otherwise
	 * @param errorReason used when {@code target} is FAILED, ignored otherwise
	 * @throws IllegalTransitionException if the edge is not part of the state graph, or
	 *                                    COMPLETED is requested without an output reference
	 */
	public void apply(TryOnSession session, SessionStatus target, String outputRef, String errorReason, Instant now) {
		SessionStatus current = session.getStatus();
		if (current == null || !current.canTransitionTo(target)) {
			throw new IllegalTransitionException(current, target,
					current != null && current.isTerminal() ? "session is already terminal" : "edge not allowed");
		}

		if (target == SessionStatus.COMPLETED) {
			if (!StringUtils.hasText(outputRef)) {
				throw new IllegalTransitionException(current, target, "output reference is required");
			}
			session.setOutputImageRef(outputRef);
		} else if (target == SessionStatus.FAILED) {
			session.setErrorReason(boundErrorReason(errorReason));
		}

		session.setStatus(target);
		session.setUpdatedAt(now);
	}

	/**
	 * Trims and truncates a user-facing error text. Blank input yields {@link #GENERIC_FAILURE}.
	 */
	public String boundErrorReason(String errorReason) {
		if (!StringUtils.hasText(errorReason)) {
			return GENERIC_FAILURE;
		}
		String trimmed = errorReason.strip();
		int max = sessionProperties.getDispatcher().getErrorDetailMaxLength();
		if (trimmed.length() <= max) {
			return trimmed;
		}
		return trimmed.substring(0, max - 3) + "...";
	}
}
