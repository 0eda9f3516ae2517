package com.esgcredit.model;

import java.time.YearMonth;
import java.util.Objects;

/**
 * 模块说明：SeriesPoint（class）。
 * 主要职责：某一月份的 E/S/G 分数快照。
 * 使用建议：修改该类型时应同步关注上下游调用，避免影响整体流程稳定性。
 */
public final class SeriesPoint {
    public final YearMonth period;
    public final double environmental;
    public final double social;
    public final double governance;

    public SeriesPoint(YearMonth period, double environmental, double social, double governance) {
        this.period = Objects.requireNonNull(period, "period");
        this.environmental = environmental;
        this.social = social;
        this.governance = governance;
    }

    public double value(Pillar pillar) {
        switch (pillar) {
            case ENVIRONMENTAL:
                return environmental;
            case SOCIAL:
                return social;
            default:
                return governance;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SeriesPoint)) {
            return false;
        }
        SeriesPoint that = (SeriesPoint) o;
        return period.equals(that.period)
                && Double.compare(environmental, that.environmental) == 0
                && Double.compare(social, that.social) == 0
                && Double.compare(governance, that.governance) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(period, environmental, social, governance);
    }

    @Override
    public String toString() {
        return period + "(E=" + environmental + ", S=" + social + ", G=" + governance + ")";
    }
}
