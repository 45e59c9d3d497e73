package com.quantbacktest.rebalancer.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Entity representing one stored daily bar for an instrument.
 * This is the persistent version of PriceBar.
 */
@Entity
@Table(name = "historical_market_data", uniqueConstraints = {
        @UniqueConstraint(name = "uk_code_date", columnNames = { "code", "date" })
}, indexes = {
        @Index(name = "idx_code_date", columnList = "code, date"),
        @Index(name = "idx_code", columnList = "code")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HistoricalMarketData {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "code", nullable = false, length = 20)
    private String code;

    @Column(name = "date", nullable = false)
    private LocalDate date;

    @Column(name = "open", nullable = false, precision = 12, scale = 4)
    private BigDecimal open;

    @Column(name = "high", nullable = false, precision = 12, scale = 4)
    private BigDecimal high;

    @Column(name = "low", nullable = false, precision = 12, scale = 4)
    private BigDecimal low;

    @Column(name = "close", nullable = false, precision = 12, scale = 4)
    private BigDecimal close;

    @Column(name = "volume", nullable = false)
    private Long volume;

    /**
     * Convert entity to domain PriceBar object.
     */
    public PriceBar toPriceBar() {
        return PriceBar.builder()
                .date(this.date)
                .open(this.open)
                .high(this.high)
                .low(this.low)
                .close(this.close)
                .volume(this.volume)
                .build();
    }
}
