package com.quantbacktest.rebalancer.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entity describing one instrument of the selection universe.
 * Loaded once at simulation start and never modified during a run.
 */
@Entity
@Table(name = "instruments", indexes = {
        @Index(name = "idx_instrument_active", columnList = "active")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Instrument {

    @Id
    @Column(name = "code", nullable = false, length = 20)
    private String code;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "market", length = 20)
    private String market;

    @Column(name = "industry", length = 100)
    private String industry;

    @Column(name = "active", nullable = false)
    @Builder.Default
    private boolean active = true;
}
