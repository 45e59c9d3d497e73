package com.quantbacktest.rebalancer.domain.indicator;

/**
 * Names of the values an {@link IndicatorSnapshot} may carry.
 */
public final class Indicators {

    public static final String PRICE = "price";
    public static final String HIGH_52W = "high_52w";
    public static final String LOW_52W = "low_52w";
    public static final String MA_TREND = "ma_trend";
    public static final String RSI = "rsi";
    public static final String ROC_10 = "roc_10";
    public static final String MACD = "macd";
    public static final String MACD_SIGNAL = "macd_signal";
    public static final String MACD_HIST = "macd_hist";
    public static final String BB_UPPER = "bb_upper";
    public static final String BB_MIDDLE = "bb_middle";
    public static final String BB_LOWER = "bb_lower";
    public static final String BB_POSITION = "bb_position";
    public static final String VOLATILITY = "volatility";
    public static final String ATR = "atr";
    public static final String PRICE_POSITION = "price_position";
    public static final String VOLUME_MA20 = "volume_ma20";
    public static final String VOLUME_RATIO = "volume_ratio";
    public static final String OBV = "obv";
    public static final String VPT = "vpt";

    public static final String MA5 = movingAverage(5);
    public static final String MA10 = movingAverage(10);
    public static final String MA20 = movingAverage(20);
    public static final String MA60 = movingAverage(60);

    public static final String MOMENTUM_5D = momentum(5);
    public static final String MOMENTUM_10D = momentum(10);
    public static final String MOMENTUM_20D = momentum(20);
    public static final String MOMENTUM_60D = momentum(60);

    private Indicators() {
    }

    public static String movingAverage(int period) {
        return "ma" + period;
    }

    public static String momentum(int days) {
        return "momentum_" + days + "d";
    }
}
