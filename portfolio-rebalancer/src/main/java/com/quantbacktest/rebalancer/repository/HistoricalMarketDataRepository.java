package com.quantbacktest.rebalancer.repository;

import com.quantbacktest.rebalancer.domain.HistoricalMarketData;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Repository for accessing stored daily bars.
 */
@Repository
public interface HistoricalMarketDataRepository extends JpaRepository<HistoricalMarketData, Long> {

    /**
     * Every bar for an instrument, oldest first.
     */
    List<HistoricalMarketData> findByCodeOrderByDateAsc(String code);

    /**
     * Check if a bar exists for an instrument and date.
     */
    boolean existsByCodeAndDate(String code, LocalDate date);

    long countByCode(String code);
}
