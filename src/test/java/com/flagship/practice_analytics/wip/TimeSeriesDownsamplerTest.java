package com.flagship.practice_analytics.wip;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TimeSeriesDownsamplerTest {

    private static final LocalDate START = LocalDate.of(2023, 1, 1);

    private final TimeSeriesDownsampler downsampler = new TimeSeriesDownsampler();

    private static DailyMetric day(int offset, boolean active) {
        BigDecimal production = active ? new BigDecimal("100") : BigDecimal.ZERO;
        return DailyMetric.builder()
            .date(START.plusDays(offset))
            .production(production)
            .adjustments(BigDecimal.ZERO)
            .disbursements(BigDecimal.ZERO)
            .billing(BigDecimal.ZERO)
            .provisions(BigDecimal.ZERO)
            .wipBalance(new BigDecimal("500"))
            .build();
    }

    /**
     * Series of {@code size} days where the days at the given offsets are active.
     */
    private static List<DailyMetric> series(int size, Set<Integer> activeOffsets) {
        List<DailyMetric> metrics = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            metrics.add(day(i, activeOffsets.contains(i)));
        }
        return metrics;
    }

    private static void assertChronological(List<DailyMetric> metrics) {
        for (int i = 1; i < metrics.size(); i++) {
            assertTrue(metrics.get(i).getDate().isAfter(metrics.get(i - 1).getDate()),
                "not strictly ascending at index " + i);
        }
    }

    @Test
    @DisplayName("400 days with 10 active and a budget of 120 keep all active days plus 110 quiet ones")
    void testKeepsActiveDaysAndFillsWithQuietDays() {
        Set<Integer> active = Set.of(3, 40, 41, 99, 150, 151, 152, 260, 333, 399);
        List<DailyMetric> input = series(400, active);

        List<DailyMetric> output = downsampler.downsample(input, 120);

        assertEquals(120, output.size());
        assertEquals(10, output.stream().filter(DailyMetric::isActive).count());
        assertEquals(110, output.stream().filter(m -> !m.isActive()).count());
        for (int offset : active) {
            assertTrue(output.contains(input.get(offset)), "active day " + offset + " dropped");
        }
        assertEquals(120, new HashSet<>(output).size());
        assertChronological(output);
    }

    @Test
    @DisplayName("Quiet days are spread across the whole series")
    void testQuietDaysSpreadEvenly() {
        List<DailyMetric> output = downsampler.downsample(series(400, Set.of()), 40);

        assertEquals(40, output.size());
        assertEquals(START, output.get(0).getDate());
        assertTrue(output.get(39).getDate().isAfter(START.plusDays(380)));
        assertChronological(output);
    }

    @Test
    @DisplayName("A series that already fits is returned unchanged")
    void testShortSeriesUnchanged() {
        List<DailyMetric> input = series(50, Set.of(1, 2, 3));

        assertSame(input, downsampler.downsample(input, 50));
        assertSame(input, downsampler.downsample(input, 120));
    }

    @Test
    @DisplayName("All-active series are kept whole even when they exceed the budget")
    void testAllActiveExceedsBudget() {
        Set<Integer> all = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            all.add(i);
        }
        List<DailyMetric> input = series(200, all);

        List<DailyMetric> output = downsampler.downsample(input, 60);

        assertEquals(input, output);
    }

    @Test
    @DisplayName("Downsampling twice gives the same result as once")
    void testIdempotent() {
        List<DailyMetric> once = downsampler.downsample(series(730, Set.of(5, 100, 500)), 120);
        List<DailyMetric> twice = downsampler.downsample(once, 120);

        assertEquals(once, twice);
    }

    @Test
    @DisplayName("Empty series stays empty")
    void testEmpty() {
        assertTrue(downsampler.downsample(new ArrayList<>(), 10).isEmpty());
    }

    @Test
    @DisplayName("A non-positive budget is rejected")
    void testInvalidTarget() {
        List<DailyMetric> input = series(10, Set.of());

        assertThrows(IllegalArgumentException.class, () -> downsampler.downsample(input, 0));
        assertThrows(IllegalArgumentException.class, () -> downsampler.downsample(input, -5));
    }
}
