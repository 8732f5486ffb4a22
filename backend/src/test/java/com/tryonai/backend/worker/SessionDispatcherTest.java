package com.tryonai.backend.worker;

import com.tryonai.backend.entity.TryOnSession;
import com.tryonai.backend.enums.GarmentCategory;
import com.tryonai.backend.enums.SessionStatus;
import com.tryonai.backend.exception.TransformException;
import com.tryonai.backend.service.SessionStore;
import com.tryonai.backend.service.StatusUpdateResult;
import com.tryonai.backend.service.storage.StorageGateway;
import com.tryonai.backend.service.transform.TransformClient;
import com.tryonai.backend.service.transform.TransformRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class SessionDispatcherTest {

	private static final String OUTPUT_REF = "/uploads/outputs/x_output.png";

	@TempDir
	Path tempDir;

	private SessionStore sessionStore;
	private StorageGateway storageGateway;
	private TransformClient transformClient;
	private SessionDispatcher dispatcher;

	private UUID id;
	private TryOnSession session;

	@BeforeEach
	void setUp() {
		sessionStore = mock(SessionStore.class);
		storageGateway = mock(StorageGateway.class);
		transformClient = mock(TransformClient.class);
		dispatcher = new SessionDispatcher(sessionStore, storageGateway, transformClient, new SyncTaskExecutor());

		id = UUID.randomUUID();
		session = new TryOnSession();
		session.setId(id);
		session.setStatus(SessionStatus.CREATED);
		session.setCategory(GarmentCategory.UPPER_BODY);
		session.setSubjectImageRef("/uploads/users/" + id + "_user.png");
		session.setOverlayImageRef("/uploads/garments/" + id + "_garment.png");
	}

	@Test
	void successfulRunCompletesWithOutputAndRemovesTempFile() throws Exception {
		Path produced = Files.write(tempDir.resolve("out.png"), new byte[]{1, 2, 3});
		givenLoadedAndStarted();
		when(transformClient.run(any())).thenReturn(produced);
		when(storageGateway.saveOutput(id, produced)).thenReturn(OUTPUT_REF);
		when(sessionStore.updateStatus(id, SessionStatus.COMPLETED, OUTPUT_REF, null))
				.thenReturn(StatusUpdateResult.updated(session));

		dispatcher.submit(id);

		InOrder order = inOrder(sessionStore, transformClient, storageGateway);
		order.verify(sessionStore).get(id);
		order.verify(sessionStore).updateStatus(id, SessionStatus.PROCESSING);
		order.verify(transformClient).run(any());
		order.verify(storageGateway).saveOutput(id, produced);
		order.verify(sessionStore).updateStatus(id, SessionStatus.COMPLETED, OUTPUT_REF, null);
		verify(sessionStore, never()).updateStatus(eq(id), eq(SessionStatus.FAILED), any(), any());
		assertThat(produced).doesNotExist();
	}

	@Test
	void transformRequestCarriesInputsAndCategory() throws Exception {
		givenLoadedAndStarted();
		when(transformClient.run(any())).thenThrow(new TransformException("Processing timeout"));

		dispatcher.submit(id);

		ArgumentCaptor<TransformRequest> captor = ArgumentCaptor.forClass(TransformRequest.class);
		verify(transformClient).run(captor.capture());
		assertThat(captor.getValue().getSubjectImageRef()).isEqualTo(session.getSubjectImageRef());
		assertThat(captor.getValue().getOverlayImageRef()).isEqualTo(session.getOverlayImageRef());
		assertThat(captor.getValue().getCategory()).isEqualTo(GarmentCategory.UPPER_BODY);
	}

	@Test
	void transformErrorFailsWithItsUserMessage() throws Exception {
		givenLoadedAndStarted();
		when(transformClient.run(any())).thenThrow(new TransformException("timeout", new RuntimeException("socket read at 10.0.0.3")));

		dispatcher.submit(id);

		verify(sessionStore).updateStatus(id, SessionStatus.FAILED, null, "timeout");
		verify(storageGateway, never()).saveOutput(any(), any());
	}

	@Test
	void unexpectedErrorFailsWithGenericMessageAndDoesNotPropagate() throws Exception {
		givenLoadedAndStarted();
		when(transformClient.run(any())).thenThrow(new IllegalStateException("NullPointer deep inside"));

		dispatcher.submit(id);

		verify(sessionStore).updateStatus(id, SessionStatus.FAILED, null, SessionDispatcher.INTERNAL_FAILURE);
	}

	@Test
	void missingSessionIsIgnored() throws Exception {
		when(sessionStore.get(id)).thenReturn(Optional.empty());

		dispatcher.submit(id);

		verify(sessionStore, never()).updateStatus(any(), any());
		verify(sessionStore, never()).updateStatus(any(), any(), any(), any());
		verifyNoInteractions(transformClient, storageGateway);
	}

	@Test
	void sessionReapedBeforeProcessingStartsAborts() throws Exception {
		when(sessionStore.get(id)).thenReturn(Optional.of(session));
		when(sessionStore.updateStatus(id, SessionStatus.PROCESSING)).thenReturn(StatusUpdateResult.notFound());

		dispatcher.submit(id);

		verifyNoInteractions(transformClient);
		verify(sessionStore, never()).updateStatus(any(), any(), any(), any());
	}

	@Test
	void alreadyStartedSessionIsNotRunTwice() throws Exception {
		when(sessionStore.get(id)).thenReturn(Optional.of(session));
		when(sessionStore.updateStatus(id, SessionStatus.PROCESSING))
				.thenReturn(StatusUpdateResult.illegalTransition(session, "edge not allowed"));

		dispatcher.submit(id);

		verifyNoInteractions(transformClient);
	}

	@Test
	void outputIsDiscardedWhenSessionVanishesBeforeCompletion() throws Exception {
		Path produced = Files.write(tempDir.resolve("out.png"), new byte[]{1});
		givenLoadedAndStarted();
		when(transformClient.run(any())).thenReturn(produced);
		when(storageGateway.saveOutput(id, produced)).thenReturn(OUTPUT_REF);
		when(sessionStore.updateStatus(id, SessionStatus.COMPLETED, OUTPUT_REF, null))
				.thenReturn(StatusUpdateResult.notFound());

		dispatcher.submit(id);

		verify(storageGateway).delete(OUTPUT_REF);
		verify(sessionStore, never()).updateStatus(eq(id), eq(SessionStatus.FAILED), isNull(), anyString());
	}

	@Test
	void outputIsDiscardedWhenCompletionWriteFails() throws Exception {
		Path produced = Files.write(tempDir.resolve("out.png"), new byte[]{1});
		givenLoadedAndStarted();
		when(transformClient.run(any())).thenReturn(produced);
		when(storageGateway.saveOutput(id, produced)).thenReturn(OUTPUT_REF);
		when(sessionStore.updateStatus(id, SessionStatus.COMPLETED, OUTPUT_REF, null))
				.thenThrow(new DataAccessResourceFailureException("db down"));

		dispatcher.submit(id);

		InOrder order = inOrder(storageGateway, sessionStore);
		order.verify(storageGateway).delete(OUTPUT_REF);
		order.verify(sessionStore).updateStatus(id, SessionStatus.FAILED, null, SessionDispatcher.INTERNAL_FAILURE);
		assertThat(produced).doesNotExist();
	}

	@Test
	void rejectedSubmissionMarksSessionFailed() {
		TaskExecutor saturated = task -> {
			throw new TaskRejectedException("queue full");
		};
		dispatcher = new SessionDispatcher(sessionStore, storageGateway, transformClient, saturated);
		when(sessionStore.updateStatus(id, SessionStatus.PROCESSING)).thenReturn(StatusUpdateResult.updated(session));
		when(sessionStore.updateStatus(id, SessionStatus.FAILED, null, SessionDispatcher.BUSY_FAILURE))
				.thenReturn(StatusUpdateResult.updated(session));

		dispatcher.submit(id);

		InOrder order = inOrder(sessionStore);
		order.verify(sessionStore).updateStatus(id, SessionStatus.PROCESSING);
		order.verify(sessionStore).updateStatus(id, SessionStatus.FAILED, null, SessionDispatcher.BUSY_FAILURE);
		verifyNoInteractions(transformClient);
	}

	@Test
	void storeFailureWhileLoadingIsContained() {
		when(sessionStore.get(id)).thenThrow(new DataAccessResourceFailureException("db down"));

		dispatcher.submit(id);

		verifyNoInteractions(transformClient);
	}

	private void givenLoadedAndStarted() {
		when(sessionStore.get(id)).thenReturn(Optional.of(session));
		when(sessionStore.updateStatus(id, SessionStatus.PROCESSING)).thenReturn(StatusUpdateResult.updated(session));
		when(sessionStore.updateStatus(eq(id), eq(SessionStatus.FAILED), any(), any()))
				.thenReturn(StatusUpdateResult.updated(session));
	}
}
