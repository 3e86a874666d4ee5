package com.flagship.practice_analytics.wip;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reduces a daily series to roughly {@code targetPoints} points for charting.
 *
 * Every day with financial activity is kept. Only quiet days (all category totals
 * zero, balance merely carried forward) are sampled, evenly, to fill whatever room
 * is left. If the active days alone exceed the target, the output is larger than
 * the target: the budget is a target, not a hard cap.
 */
@Component
public class TimeSeriesDownsampler {

    /**
     * Downsamples a daily series.
     *
     * @param metrics daily metrics, keyed by date
     * @param targetPoints desired number of points, must be positive
     * @return the input itself when it already fits, otherwise a new list sorted by date
     * @throws IllegalArgumentException if targetPoints is zero or negative
     */
    public List<DailyMetric> downsample(List<DailyMetric> metrics, int targetPoints) {
        if (targetPoints <= 0) {
            throw new IllegalArgumentException("Target points must be positive: " + targetPoints);
        }
        if (metrics.size() <= targetPoints) {
            return metrics;
        }

        List<DailyMetric> activeDays = new ArrayList<>();
        List<DailyMetric> quietDays = new ArrayList<>();
        for (DailyMetric metric : metrics) {
            if (metric.isActive()) {
                activeDays.add(metric);
            } else {
                quietDays.add(metric);
            }
        }

        List<DailyMetric> result = new ArrayList<>(activeDays);

        int remainingSlots = targetPoints - activeDays.size();
        if (remainingSlots > 0 && !quietDays.isEmpty()) {
            result.addAll(sampleEvenly(quietDays, remainingSlots));
        }

        result.sort(Comparator.comparing(DailyMetric::getDate));
        return result;
    }

    /**
     * Picks {@code min(slots, points.size())} points spread evenly over the list,
     * always starting with the first one and keeping the original order.
     * Positions are {@code floor(i * size / slots)}, not a fixed {@code ceil(size / slots)}
     * stride: a fixed stride under-fills the slots (390 quiet days into 110 slots gives 98).
     */
    private static List<DailyMetric> sampleEvenly(List<DailyMetric> points, int slots) {
        if (points.size() <= slots) {
            return points;
        }
        List<DailyMetric> sample = new ArrayList<>(slots);
        for (int i = 0; i < slots; i++) {
            int index = (int) ((long) i * points.size() / slots);
            sample.add(points.get(index));
        }
        return sample;
    }
}
