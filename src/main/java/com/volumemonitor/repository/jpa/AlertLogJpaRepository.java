package com.volumemonitor.repository.jpa;

import com.volumemonitor.entity.AlertLogEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the alerts table.
 */
@Repository
public interface AlertLogJpaRepository extends JpaRepository<AlertLogEntity, Long> {

    @Query("SELECT a FROM AlertLogEntity a WHERE a.timestamp >= :from AND a.timestamp < :to ORDER BY a.timestamp DESC")
    List<AlertLogEntity> findByDateRange(@Param("from") LocalDateTime from, @Param("to") LocalDateTime to);

    long countByTimestampGreaterThanEqualAndTimestampLessThan(LocalDateTime from, LocalDateTime to);
}
