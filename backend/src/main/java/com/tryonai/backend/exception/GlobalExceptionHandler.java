package com.tryonai.backend.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

	@ExceptionHandler(InvalidInputException.class)
	public ResponseEntity<Map<String, Object>> handleInvalidInput(InvalidInputException ex) {
		log.info("Rejected request ({}): {}", ex.getReason(), ex.getMessage());
		return ResponseEntity.badRequest()
				.body(Map.of(
						"detail", ex.getMessage(),
						"reason", ex.getReason().name()
				));
	}

	@ExceptionHandler({MissingServletRequestPartException.class, MissingServletRequestParameterException.class,
			MethodArgumentTypeMismatchException.class})
	public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
		return ResponseEntity.badRequest()
				.body(Map.of(
						"detail", ex.getMessage(),
						"reason", InvalidInputException.Reason.INVALID_INPUT.name()
				));
	}

	@ExceptionHandler(MaxUploadSizeExceededException.class)
	public ResponseEntity<Map<String, Object>> handleMaxUploadSize(MaxUploadSizeExceededException ex) {
		return ResponseEntity.badRequest()
				.body(Map.of(
						"detail", "File too large",
						"reason", InvalidInputException.Reason.TOO_LARGE.name()
				));
	}

	@ExceptionHandler(SessionNotFoundException.class)
	public ResponseEntity<Map<String, Object>> handleNotFound(SessionNotFoundException ex) {
		return ResponseEntity.status(HttpStatus.NOT_FOUND)
				.body(Map.of("detail", "Session not found"));
	}

	@ExceptionHandler({DataAccessResourceFailureException.class, CannotCreateTransactionException.class})
	public ResponseEntity<Map<String, Object>> handleStoreUnavailable(Exception ex) {
		log.error("Persistence layer unavailable: {}", ex.getMessage(), ex);
		return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
				.body(Map.of("detail", "Service temporarily unavailable"));
	}

	@ExceptionHandler(Exception.class)
	public ResponseEntity<Map<String, Object>> handleAllExceptions(Exception ex) {
		log.error("Unhandled: ", ex);
		return ResponseEntity.internalServerError()
				.body(Map.of("detail", "Internal server error"));
	}
}
