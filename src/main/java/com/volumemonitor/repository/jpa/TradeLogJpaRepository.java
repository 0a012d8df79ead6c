package com.volumemonitor.repository.jpa;

import com.volumemonitor.entity.TradeLogEntity;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the trade_logs table.
 */
@Repository
public interface TradeLogJpaRepository extends JpaRepository<TradeLogEntity, Long> {

    List<TradeLogEntity> findAllByOrderByTimestampDesc(Pageable pageable);
}
