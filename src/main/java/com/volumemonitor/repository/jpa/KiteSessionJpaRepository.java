package com.volumemonitor.repository.jpa;

import com.volumemonitor.entity.KiteSessionEntity;
import java.time.LocalDateTime;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the kite_sessions table. At most one row exists at a time.
 */
@Repository
public interface KiteSessionJpaRepository extends JpaRepository<KiteSessionEntity, String> {

    Optional<KiteSessionEntity> findFirstByExpiresAtAfterOrderByLoginTimeDesc(LocalDateTime now);
}
