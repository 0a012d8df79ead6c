package com.volumemonitor.repository.jpa;

import com.volumemonitor.entity.InstrumentEntity;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the tradable_instruments table.
 * On startup, InstrumentService checks if today's instruments exist before re-downloading.
 */
@Repository
public interface InstrumentJpaRepository extends JpaRepository<InstrumentEntity, Long> {

    List<InstrumentEntity> findByDownloadDate(LocalDate downloadDate);

    boolean existsByDownloadDate(LocalDate downloadDate);
}
