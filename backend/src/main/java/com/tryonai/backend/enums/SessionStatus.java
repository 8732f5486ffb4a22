package com.tryonai.backend.enums;

/**
 * Lifecycle states of a try-on session.
 * <p>
 * CREATED is the only initial state, COMPLETED and FAILED are terminal:
 * <pre>
 *   CREATED -> PROCESSING -> COMPLETED
 *                         -> FAILED
 * </pre>
 */
public enum SessionStatus {
	CREATED,
	PROCESSING,
	COMPLETED,
	FAILED;

	public boolean isTerminal() {
		return this == COMPLETED || this == FAILED;
	}

	public boolean canTransitionTo(SessionStatus target) {
		if (target == null) {
			return false;
		}
		return switch (this) {
			case CREATED -> target == PROCESSING;
			case PROCESSING -> target == COMPLETED || target == FAILED;
			case COMPLETED, FAILED -> false;
		};
	}
}
