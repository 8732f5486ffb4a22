package com.tryonai.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tryonai.backend.entity.TryOnSession;
import com.tryonai.backend.enums.SessionStatus;
import com.tryonai.backend.exception.TransformException;
import com.tryonai.backend.scheduled.SessionReaper;
import com.tryonai.backend.service.SessionStore;
import com.tryonai.backend.service.storage.StorageGateway;
import com.tryonai.backend.service.transform.TransformClient;
import com.tryonai.backend.service.transform.TransformRequest;
import com.tryonai.backend.support.MutableClock;
import com.tryonai.backend.support.TestImages;
import com.tryonai.backend.worker.SessionDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.endsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class SessionLifecycleIntegrationTest {

	private static final Duration WAIT = Duration.ofSeconds(10);

	@TestConfiguration
	static class ClockConfig {
		@Bean
		@Primary
		MutableClock testClock() {
			return new MutableClock(Instant.now());
		}
	}

	@Autowired
	MockMvc mvc;

	@Autowired
	ObjectMapper objectMapper;

	@Autowired
	SessionStore sessionStore;

	@Autowired
	StorageGateway storageGateway;

	@Autowired
	SessionReaper sessionReaper;

	@Autowired
	SessionDispatcher sessionDispatcher;

	@Autowired
	MutableClock clock;

	@MockBean
	TransformClient transformClient;

	@BeforeEach
	void producePngByDefault() throws Exception {
		when(transformClient.run(any())).thenAnswer(invocation -> {
			Path output = Files.createTempFile("it-out-", ".png");
			Files.write(output, TestImages.png());
			return output;
		});
	}

	@Test
	void uploadedSessionCompletesWithStoredOutput() throws Exception {
		UUID id = createSession("upper_body");

		TryOnSession session = awaitTerminal(id);

		assertThat(session.getStatus()).isEqualTo(SessionStatus.COMPLETED);
		assertThat(session.getOutputImageRef()).isNotBlank();
		assertThat(session.getErrorReason()).isNull();
		assertThat(storageGateway.exists(session.getOutputImageRef())).isTrue();

		mvc.perform(get("/api/tryon/sessions/{id}", id))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.status").value("COMPLETED"))
				.andExpect(jsonPath("$.output_image_url").value(endsWith(session.getOutputImageRef())));
	}

	@Test
	void transformErrorMarksSessionFailedWithItsMessage() throws Exception {
		when(transformClient.run(any())).thenThrow(new TransformException("timeout"));

		UUID id = createSession("lower_body");

		TryOnSession session = awaitTerminal(id);

		assertThat(session.getStatus()).isEqualTo(SessionStatus.FAILED);
		assertThat(session.getErrorReason()).isEqualTo("timeout");
		assertThat(session.getOutputImageRef()).isNull();
	}

	@Test
	void expiredSessionIsReapedWithItsArtifacts() throws Exception {
		UUID id = createSession("dresses");
		TryOnSession finished = awaitTerminal(id);

		clock.advance(Duration.ofHours(2));
		sessionReaper.sweep();

		assertThat(sessionStore.get(id)).isEmpty();
		assertThat(storageGateway.exists(finished.getSubjectImageRef())).isFalse();
		assertThat(storageGateway.exists(finished.getOverlayImageRef())).isFalse();
		assertThat(storageGateway.exists(finished.getOutputImageRef())).isFalse();
		mvc.perform(get("/api/tryon/sessions/{id}", id))
				.andExpect(status().isNotFound());
	}

	@Test
	void dispatchingUnknownSessionCreatesNothing() throws Exception {
		UUID unknown = UUID.randomUUID();

		sessionDispatcher.submit(unknown);

		verify(transformClient, after(500).never()).run(argThat((TransformRequest r) -> r != null && unknown.equals(r.getSessionId())));
		assertThat(sessionStore.get(unknown)).isEmpty();
	}

	@Test
	void invalidCategoryIsRejectedWithoutCreatingSession() throws Exception {
		long before = sessionStore.count();

		mvc.perform(multipart("/api/tryon/sessions")
						.file(TestImages.pngPart("user_image", "me.png"))
						.file(TestImages.pngPart("garment_image", "hat.png"))
						.param("user_token", "it-user")
						.param("category", "hats"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.reason").value("INVALID_INPUT"));

		assertThat(sessionStore.count()).isEqualTo(before);
	}

	private UUID createSession(String category) throws Exception {
		String body = mvc.perform(multipart("/api/tryon/sessions")
						.file(TestImages.pngPart("user_image", "me.png"))
						.file(TestImages.pngPart("garment_image", "garment.png"))
						.param("user_token", "it-user")
						.param("category", category))
				.andExpect(status().isCreated())
				.andReturn().getResponse().getContentAsString();
		JsonNode json = objectMapper.readTree(body);
		return UUID.fromString(json.get("session_id").asText());
	}

	private TryOnSession awaitTerminal(UUID id) throws InterruptedException {
		long deadline = System.nanoTime() + WAIT.toNanos();
		while (System.nanoTime() < deadline) {
			TryOnSession session = sessionStore.get(id).orElseThrow();
			if (session.getStatus().isTerminal()) {
				return session;
			}
			Thread.sleep(50);
		}
		throw new AssertionError("Session " + id + " did not finish within " + WAIT);
	}
}
