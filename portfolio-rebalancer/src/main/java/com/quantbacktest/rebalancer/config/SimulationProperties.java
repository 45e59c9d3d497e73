package com.quantbacktest.rebalancer.config;

import com.quantbacktest.rebalancer.domain.RebalanceFrequency;
import com.quantbacktest.rebalancer.domain.SimulationConfig;
import com.quantbacktest.rebalancer.domain.TradeCostModel;
import com.quantbacktest.rebalancer.domain.indicator.IndicatorSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Simulation defaults bound from {@code rebalancer.*}.
 * Domain components never see this class; it is turned into immutable settings per run.
 */
@Data
@ConfigurationProperties(prefix = "rebalancer")
public class SimulationProperties {

    private BigDecimal initialCapital = new BigDecimal("1000000");
    private int maxPositions = 6;
    private int minDataDays = 100;
    private int lotSize = 100;
    private BigDecimal cashReserveRatio = new BigDecimal("0.10");
    private RebalanceFrequency frequency = RebalanceFrequency.QUARTERLY;

    private BigDecimal commissionRate = new BigDecimal("0.0003");
    private BigDecimal minCommission = new BigDecimal("5");
    private BigDecimal stampTaxRate = new BigDecimal("0.001");

    private double riskFreeRate = 0.03;
    private double benchmarkReturn = 0.08;

    private Indicators indicators = new Indicators();
    private Workers workers = new Workers();

    @Data
    public static class Indicators {
        private int lookbackDays = 60;
        private List<Integer> maPeriods = new ArrayList<>(List.of(5, 10, 20, 60));
        private List<Integer> momentumPeriods = new ArrayList<>(List.of(5, 10, 20, 60));
        private int rsiPeriod = 14;
        private int macdFast = 12;
        private int macdSlow = 26;
        private int macdSignal = 9;
        private int bollingerPeriod = 20;
        private double bollingerStdDev = 2.0;
        private int atrPeriod = 14;
        private int volatilityWindow = 20;
        private int volumeWindow = 20;
        private int pricePositionWindow = 60;
        private int extremesWindow = 252;
        private int tradingDaysPerYear = 252;
    }

    @Data
    public static class Workers {
        private boolean enabled = true;
        /** Queue consumers. */
        private int threadCount = 3;
        /** Threads shared by all runs for per-instrument indicator evaluation. */
        private int indicatorThreads = 4;
    }

    public TradeCostModel toCostModel() {
        return TradeCostModel.builder()
                .commissionRate(commissionRate)
                .minCommission(minCommission)
                .stampTaxRate(stampTaxRate)
                .build();
    }

    public IndicatorSettings toIndicatorSettings() {
        return IndicatorSettings.builder()
                .lookbackDays(indicators.lookbackDays)
                .maPeriods(indicators.maPeriods)
                .momentumPeriods(indicators.momentumPeriods)
                .rsiPeriod(indicators.rsiPeriod)
                .macdFast(indicators.macdFast)
                .macdSlow(indicators.macdSlow)
                .macdSignal(indicators.macdSignal)
                .bollingerPeriod(indicators.bollingerPeriod)
                .bollingerStdDev(indicators.bollingerStdDev)
                .atrPeriod(indicators.atrPeriod)
                .volatilityWindow(indicators.volatilityWindow)
                .volumeWindow(indicators.volumeWindow)
                .pricePositionWindow(indicators.pricePositionWindow)
                .extremesWindow(indicators.extremesWindow)
                .tradingDaysPerYear(indicators.tradingDaysPerYear)
                .build();
    }

    public SimulationConfig toSimulationConfig() {
        return SimulationConfig.builder()
                .initialCapital(initialCapital)
                .maxPositions(maxPositions)
                .minDataDays(minDataDays)
                .lotSize(lotSize)
                .cashReserveRatio(cashReserveRatio)
                .costModel(toCostModel())
                .indicatorSettings(toIndicatorSettings())
                .build();
    }
}
