package com.tryonai.backend.exception;

/**
 * Failure reported by the transform collaborator. The message is shown to the client,
 * so it must not carry internal details; those belong in the cause.
 */
public class TransformException extends Exception {
	public TransformException(String userMessage) {
		super(userMessage);
	}

	public TransformException(String userMessage, Throwable cause) {
		super(userMessage, cause);
	}
}
