package com.tryonai.backend.service;

import com.tryonai.backend.listener.SessionCreatedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
@RequiredArgsConstructor
@Slf4j
public class SessionEventPublisher {

	private final ApplicationEventPublisher applicationEventPublisher;

	public void publishSessionCreatedEvent(final UUID sessionId) {
		log.debug("Publishing session created event for sessionId: {}", sessionId);
		applicationEventPublisher.publishEvent(new SessionCreatedEvent(sessionId));
	}
}
