package com.tryonai.backend.exception;

import com.tryonai.backend.enums.SessionStatus;
import lombok.Getter;

@Getter
public class IllegalTransitionException extends RuntimeException {
	private final SessionStatus from;
	private final SessionStatus to;

	public IllegalTransitionException(SessionStatus from, SessionStatus to, String message) {
		super(String.format("Illegal transition %s -> %s: %s", from, to, message));
		this.from = from;
		this.to = to;
	}
}
