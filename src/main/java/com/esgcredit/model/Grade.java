package com.esgcredit.model;

/**
 * 模块说明：Grade（enum）。
 * 主要职责：七级信用可持续性等级，声明顺序即从高到低。
 * 使用建议：修改该类型时应同步关注上下游调用，避免影响整体流程稳定性。
 */
public enum Grade {
    A_PLUS("A+"),
    A("A"),
    A_MINUS("A-"),
    B_PLUS("B+"),
    B("B"),
    B_MINUS("B-"),
    C("C");

    private final String label;

    Grade(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * True when this grade is the same as or better than {@code other}.
     */
    public boolean atLeast(Grade other) {
        return ordinal() <= other.ordinal();
    }

    /**
     * The next grade up, or null for the top grade.
     */
    public Grade better() {
        return ordinal() == 0 ? null : values()[ordinal() - 1];
    }

    public static Grade fromLabel(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("grade label is null");
        }
        String t = raw.trim();
        for (Grade g : values()) {
            if (g.label.equalsIgnoreCase(t) || g.name().equalsIgnoreCase(t)) {
                return g;
            }
        }
        throw new IllegalArgumentException("unknown grade: " + raw);
    }

    @Override
    public String toString() {
        return label;
    }
}
