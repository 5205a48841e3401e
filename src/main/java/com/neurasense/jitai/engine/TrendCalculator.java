package com.neurasense.jitai.engine;

import com.neurasense.jitai.domain.CheckinObservation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Rolling mood/stress trend over a window of check-ins.
 * <p>
 * The slope compares the mean mood of the second half of the window with the first half,
 * scaled down by 10. With fewer than {@link #MIN_POINTS_FOR_SLOPE} observations the slope is
 * reported as a neutral 0.0.
 */
public final class TrendCalculator {

    public static final String MOOD_AVG = "mood_avg_7d";
    public static final String STRESS_AVG = "stress_avg_7d";
    public static final String MOOD_SLOPE = "mood_slope";
    public static final String DIRECTION = "direction";
    public static final String CHECKIN_COUNT = "checkin_count_7d";

    public static final String IMPROVING = "improving";
    public static final String STABLE = "stable";
    public static final String WORSENING = "worsening";

    static final int MIN_POINTS_FOR_SLOPE = 4;
    static final double DEAD_BAND = 0.1;
    static final double SLOPE_SCALE = 10.0;
    static final int NEUTRAL_VALUE = 5;

    private TrendCalculator() {}

    /**
     * @param observations window contents, oldest first
     * @return trend variables in their fixed order
     */
    public static Map<String, Object> compute(List<CheckinObservation> observations) {
        if (observations == null || observations.isEmpty()) {
            return neutral();
        }
        double[] moods = values(observations, CheckinObservation::getMood);
        double[] stresses = values(observations, CheckinObservation::getStress);

        double slope = slope(moods);
        Map<String, Object> trend = new LinkedHashMap<>();
        trend.put(MOOD_AVG, round(mean(moods, 0, moods.length), 1));
        trend.put(STRESS_AVG, round(mean(stresses, 0, stresses.length), 1));
        trend.put(MOOD_SLOPE, round(slope, 3));
        trend.put(DIRECTION, direction(slope));
        trend.put(CHECKIN_COUNT, observations.size());
        return trend;
    }

    public static Map<String, Object> neutral() {
        Map<String, Object> trend = new LinkedHashMap<>();
        trend.put(MOOD_AVG, 5.0);
        trend.put(STRESS_AVG, 5.0);
        trend.put(MOOD_SLOPE, 0.0);
        trend.put(DIRECTION, STABLE);
        trend.put(CHECKIN_COUNT, 0);
        return trend;
    }

    static double slope(double[] moods) {
        if (moods.length < MIN_POINTS_FOR_SLOPE) {
            return 0.0;
        }
        int mid = moods.length / 2;
        double firstHalf = mean(moods, 0, mid);
        double secondHalf = mean(moods, mid, moods.length);
        return (secondHalf - firstHalf) / SLOPE_SCALE;
    }

    static String direction(double slope) {
        if (slope < -DEAD_BAND) {
            return WORSENING;
        }
        if (slope > DEAD_BAND) {
            return IMPROVING;
        }
        return STABLE;
    }

    private static double[] values(List<CheckinObservation> observations,
                                   Function<CheckinObservation, Integer> field) {
        double[] result = new double[observations.size()];
        for (int i = 0; i < result.length; i++) {
            Integer value = field.apply(observations.get(i));
            result[i] = value != null ? value : NEUTRAL_VALUE;
        }
        return result;
    }

    private static double mean(double[] values, int from, int to) {
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    // Half-even on the exact binary value, so 2.25 -> 2.2 and 2.35 -> 2.4.
    static double round(double value, int scale) {
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }
}
