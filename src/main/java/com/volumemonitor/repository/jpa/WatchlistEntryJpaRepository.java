package com.volumemonitor.repository.jpa;

import com.volumemonitor.entity.WatchlistEntryEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for the watchlist_entries table.
 */
@Repository
public interface WatchlistEntryJpaRepository extends JpaRepository<WatchlistEntryEntity, Long> {

    List<WatchlistEntryEntity> findAllByOrderBySymbolAsc();

    boolean existsBySymbol(String symbol);

    @Transactional
    long deleteBySymbol(String symbol);
}
