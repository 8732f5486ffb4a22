package com.tryonai.backend.listener;

import com.tryonai.backend.config.properties.SessionProperties;
import com.tryonai.backend.entity.TryOnSession;
import com.tryonai.backend.service.SessionStore;
import com.tryonai.backend.service.storage.StorageGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class StartupListener {

	static final int PENDING_REPORT_LIMIT = 50;

	private final SessionStore sessionStore;
	private final StorageGateway storageGateway;
	private final SessionProperties sessionProperties;

	@EventListener(ApplicationReadyEvent.class)
	public void onReady() {
		log.info("TryOnAI API ready: storage={}, session ttl={}, reaper every {} ms",
				storageGateway.type(), sessionProperties.getTtl(), sessionProperties.getReaper().getIntervalMs());
		try {
			// dispatch is at-most-once: sessions queued before a restart stay CREATED until reaped
			List<TryOnSession> pending = sessionStore.listPending(PENDING_REPORT_LIMIT);
			if (!pending.isEmpty()) {
				log.warn("{} session(s) left in CREATED from a previous run, oldest {} created at {}",
						pending.size(), pending.get(0).getId(), pending.get(0).getCreatedAt());
			}
		} catch (RuntimeException e) {
			log.warn("Could not inspect pending sessions at startup: {}", e.getMessage());
		}
	}
}
