package com.volumemonitor.entity;

import com.volumemonitor.domain.enums.InstrumentType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the watchlist_entries table: the symbols monitored when monitoring starts
 * without an explicit symbol.
 */
@Entity
@Table(name = "watchlist_entries")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WatchlistEntryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 50)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(name = "instrument_type", nullable = false, columnDefinition = "varchar(10)")
    private InstrumentType instrumentType;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
