package com.volumemonitor.repository.jpa;

import com.volumemonitor.entity.VolumeLogEntity;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the volume_logs table.
 */
@Repository
public interface VolumeLogJpaRepository extends JpaRepository<VolumeLogEntity, Long> {

    List<VolumeLogEntity> findBySymbolOrderByTimestampDesc(String symbol, Pageable pageable);

    List<VolumeLogEntity> findAllByOrderByTimestampDesc(Pageable pageable);
}
