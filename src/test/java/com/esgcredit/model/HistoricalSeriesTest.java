package com.esgcredit.model;

import com.esgcredit.core.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.YearMonth;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HistoricalSeriesTest {

    private static SeriesPoint point(int month, double e) {
        return new SeriesPoint(YearMonth.of(2024, month), e, 60.0, 70.0);
    }

    @Test
    void constructor_shouldRejectDuplicateAndDescendingPeriods() {
        assertThrows(ValidationException.class,
                () -> new HistoricalSeries("acme", List.of(point(1, 50.0), point(1, 51.0))));
        ValidationException error = assertThrows(ValidationException.class,
                () -> new HistoricalSeries("acme", List.of(point(2, 50.0), point(1, 51.0))));
        assertEquals("acme", error.subject());
    }

    @Test
    void constructor_shouldRejectNonFiniteScores() {
        assertThrows(ValidationException.class,
                () -> new HistoricalSeries("acme", List.of(point(1, Double.NaN))));
    }

    @Test
    void append_shouldLeaveReceiverUntouched() {
        HistoricalSeries series = new HistoricalSeries("acme", List.of(point(1, 50.0), point(2, 52.0)));
        HistoricalSeries longer = series.append(point(3, 55.0));

        assertEquals(2, series.size());
        assertEquals(3, longer.size());
        assertArrayEquals(new double[]{50.0, 52.0, 55.0}, longer.values(Pillar.ENVIRONMENTAL), 1e-9);
        assertEquals(YearMonth.of(2024, 3), longer.last().period);
    }

    @Test
    void append_shouldRejectOutOfOrderPoint() {
        HistoricalSeries series = new HistoricalSeries("acme", List.of(point(5, 50.0)));
        assertThrows(ValidationException.class, () -> series.append(point(4, 50.0)));
    }

    @Test
    void empty_shouldHaveNoLastPoint() {
        HistoricalSeries series = new HistoricalSeries("acme", null);
        assertNull(series.last());
        assertEquals(0, series.values(Pillar.SOCIAL).length);
    }
}
