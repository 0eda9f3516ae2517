package com.esgcredit.model;

import com.esgcredit.core.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Monthly E/S/G history of one company, strictly ascending by period.
 */
public final class HistoricalSeries {
    public final String company;
    public final List<SeriesPoint> points;

    public HistoricalSeries(String company, List<SeriesPoint> points) {
        this.company = company == null ? "" : company;
        List<SeriesPoint> safe = points == null ? List.of() : points;
        for (int i = 0; i < safe.size(); i++) {
            SeriesPoint p = safe.get(i);
            if (p == null) {
                throw new ValidationException(this.company, "history point #" + i + " is null");
            }
            if (!Double.isFinite(p.environmental) || !Double.isFinite(p.social) || !Double.isFinite(p.governance)) {
                throw new ValidationException(this.company, "history point " + p.period + " has a non-finite score");
            }
            if (i > 0) {
                SeriesPoint prev = safe.get(i - 1);
                if (prev.period.equals(p.period)) {
                    throw new ValidationException(this.company, "duplicate history period " + p.period);
                }
                if (prev.period.isAfter(p.period)) {
                    throw new ValidationException(this.company,
                            "history out of order: " + prev.period + " before " + p.period);
                }
            }
        }
        this.points = List.copyOf(safe);
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public SeriesPoint last() {
        return points.isEmpty() ? null : points.get(points.size() - 1);
    }

    public double[] values(Pillar pillar) {
        double[] out = new double[points.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = points.get(i).value(pillar);
        }
        return out;
    }

    /**
     * A new series with {@code point} appended; the receiver is left untouched.
     */
    public HistoricalSeries append(SeriesPoint point) {
        List<SeriesPoint> out = new ArrayList<>(points.size() + 1);
        out.addAll(points);
        out.add(point);
        return new HistoricalSeries(company, out);
    }
}
