package com.tryonai.backend.exception;

import lombok.Getter;

/**
 * Request rejected before any session state is written: bad category, bad file type,
 * oversized or undecodable image.
 */
@Getter
public class InvalidInputException extends RuntimeException {

	public enum Reason {
		INVALID_INPUT,
		TOO_LARGE,
		CORRUPT_IMAGE
	}

	private final Reason reason;

	public InvalidInputException(Reason reason, String message) {
		super(message);
		this.reason = reason;
	}

	public InvalidInputException(Reason reason, String message, Throwable cause) {
		super(message, cause);
		this.reason = reason;
	}
}
