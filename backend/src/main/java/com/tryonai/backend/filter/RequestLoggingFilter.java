package com.tryonai.backend.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every request with a short id (MDC key {@code requestId}, header {@code X-Request-ID})
 * and logs method, path, status and elapsed time.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestLoggingFilter extends OncePerRequestFilter {

	public static final String REQUEST_ID_HEADER = "X-Request-ID";
	public static final String MDC_KEY = "requestId";

	@Override
	protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
			throws ServletException, IOException {
		String requestId = UUID.randomUUID().toString().substring(0, 8);
		long start = System.nanoTime();
		MDC.put(MDC_KEY, requestId);
		response.setHeader(REQUEST_ID_HEADER, requestId);
		log.info("[{}] {} {}", requestId, request.getMethod(), request.getRequestURI());
		try {
			filterChain.doFilter(request, response);
			log.info("[{}] {} in {} ms", requestId, response.getStatus(), (System.nanoTime() - start) / 1_000_000);
		} catch (IOException | ServletException | RuntimeException e) {
			log.error("[{}] Error after {} ms: {}", requestId, (System.nanoTime() - start) / 1_000_000, e.getMessage(), e);
			throw e;
		} finally {
			MDC.remove(MDC_KEY);
		}
	}
}
