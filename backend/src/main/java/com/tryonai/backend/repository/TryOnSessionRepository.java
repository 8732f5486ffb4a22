package com.tryonai.backend.repository;

import com.tryonai.backend.entity.TryOnSession;
import com.tryonai.backend.enums.SessionStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface TryOnSessionRepository extends JpaRepository<TryOnSession, UUID> {

	List<TryOnSession> findByOwnerTokenOrderByCreatedAtDesc(String ownerToken, Pageable pageable);

	List<TryOnSession> findByExpiresAtBeforeOrderByExpiresAtAsc(Instant now, Pageable pageable);

	List<TryOnSession> findByStatusOrderByCreatedAtAsc(SessionStatus status, Pageable pageable);

	@Modifying(clearAutomatically = true, flushAutomatically = true)
	@Query("delete from TryOnSession s where s.id = :id")
	int deleteSessionById(@Param("id") UUID id);
}
