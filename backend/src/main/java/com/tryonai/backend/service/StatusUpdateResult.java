package com.tryonai.backend.service;

import com.tryonai.backend.entity.TryOnSession;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Optional;

/**
 * Outcome of {@link SessionStore#updateStatus}. Absence and rejected transitions are
 * reported as values so callers have to handle them explicitly.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StatusUpdateResult {

	public enum Outcome {
		UPDATED,
		NOT_FOUND,
		ILLEGAL_TRANSITION
	}

	private final Outcome outcome;
	private final TryOnSession session;
	private final String detail;

	public static StatusUpdateResult updated(TryOnSession session) {
		return new StatusUpdateResult(Outcome.UPDATED, session, null);
	}

	public static StatusUpdateResult notFound() {
		return new StatusUpdateResult(Outcome.NOT_FOUND, null, null);
	}

	public static StatusUpdateResult illegalTransition(TryOnSession current, String detail) {
		return new StatusUpdateResult(Outcome.ILLEGAL_TRANSITION, current, detail);
	}

	public boolean isUpdated() {
		return outcome == Outcome.UPDATED;
	}

	public Optional<TryOnSession> session() {
		return Optional.ofNullable(session);
	}
}
