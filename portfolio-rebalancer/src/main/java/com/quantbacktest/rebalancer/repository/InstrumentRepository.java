package com.quantbacktest.rebalancer.repository;

import com.quantbacktest.rebalancer.domain.Instrument;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for the instrument universe.
 */
@Repository
public interface InstrumentRepository extends JpaRepository<Instrument, String> {

    List<Instrument> findByActiveTrueOrderByCodeAsc();
}
