package com.esgcredit.scoring;

import com.esgcredit.config.Config;
import com.esgcredit.core.ConfigurationException;
import com.esgcredit.model.Grade;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 模块说明：GradeTable（class）。
 * 主要职责：总分到等级与利率优惠的分段映射表，构造时校验连续、无缺口、无重叠并覆盖 [0,100]。
 * 使用建议：查表不再做校验，表一旦构造成功即视为可信。
 */
public final class GradeTable {
    private static final double EPS = 1e-9;

    private final List<GradeBucket> buckets;

    public GradeTable(List<GradeBucket> buckets) {
        validate(buckets);
        this.buckets = List.copyOf(buckets);
    }

    public static GradeTable fromConfig(Config config) {
        return parse(config.getString("grade.table"));
    }

/**
 * 方法说明：parse，负责解析配置文本并构造等级表。
 * 处理流程：格式为 label:lower-upper:discount，多个分段以逗号分隔，按分数从高到低排列。
 * 维护提示：任何格式错误均抛出 ConfigurationException，不做静默修正。
 */
    public static GradeTable parse(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new ConfigurationException("grade.table", "grade table is empty");
        }
        List<GradeBucket> out = new ArrayList<>();
        for (String token : raw.split(",")) {
            String entry = token.trim();
            if (entry.isEmpty()) {
                continue;
            }
            String[] parts = entry.split(":");
            if (parts.length != 3) {
                throw new ConfigurationException("grade.table", "expected label:lower-upper:discount, got '" + entry + "'");
            }
            String[] range = parts[1].trim().split("-");
            if (range.length != 2) {
                throw new ConfigurationException("grade.table", "bad score range in '" + entry + "'");
            }
            try {
                out.add(new GradeBucket(
                        Grade.fromLabel(parts[0]),
                        Double.parseDouble(range[0].trim()),
                        Double.parseDouble(range[1].trim()),
                        Double.parseDouble(parts[2].trim())
                ));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("grade.table", "bad bucket '" + entry + "': " + e.getMessage(), e);
            }
        }
        return new GradeTable(out);
    }

    /**
     * First bucket, scanning from the top, whose lower bound is at most {@code total}.
     */
    public GradeBucket resolve(double total) {
        for (GradeBucket bucket : buckets) {
            if (total >= bucket.lower) {
                return bucket;
            }
        }
        return buckets.get(buckets.size() - 1);
    }

    public double discountFor(Grade grade) {
        for (GradeBucket bucket : buckets) {
            if (bucket.grade == grade) {
                return bucket.discountPct;
            }
        }
        return 0.0;
    }

    public List<GradeBucket> buckets() {
        return buckets;
    }

    private static void validate(List<GradeBucket> buckets) {
        if (buckets == null || buckets.isEmpty()) {
            throw new ConfigurationException("grade.table", "grade table has no buckets");
        }
        Set<Grade> seen = EnumSet.noneOf(Grade.class);
        GradeBucket previous = null;
        for (GradeBucket bucket : buckets) {
            String label = bucket.grade == null ? "?" : bucket.grade.label();
            if (bucket.grade == null || !seen.add(bucket.grade)) {
                throw new ConfigurationException("grade.table", "duplicate or missing grade label " + label);
            }
            if (!Double.isFinite(bucket.lower) || !Double.isFinite(bucket.upper) || bucket.lower >= bucket.upper) {
                throw new ConfigurationException("grade.table", String.format(Locale.US,
                        "bucket %s has empty range %.2f-%.2f", label, bucket.lower, bucket.upper));
            }
            if (!(bucket.discountPct >= 0.0)) {
                throw new ConfigurationException("grade.table", "bucket " + label + " has negative discount");
            }
            if (previous == null) {
                if (Math.abs(bucket.upper - 100.0) > EPS) {
                    throw new ConfigurationException("grade.table", "top bucket " + label + " must end at 100");
                }
            } else if (bucket.upper > previous.lower + EPS) {
                throw new ConfigurationException("grade.table", String.format(Locale.US,
                        "bucket %s overlaps %s at %.2f", label, previous.grade.label(), previous.lower));
            } else if (bucket.upper < previous.lower - EPS) {
                throw new ConfigurationException("grade.table", String.format(Locale.US,
                        "gap between %s and %s (%.2f-%.2f)", label, previous.grade.label(), bucket.upper, previous.lower));
            }
            previous = bucket;
        }
        if (Math.abs(previous.lower) > EPS) {
            throw new ConfigurationException("grade.table", "bottom bucket " + previous.grade.label() + " must start at 0");
        }
    }
}
