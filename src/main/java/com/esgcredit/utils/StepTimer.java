package com.esgcredit.utils;

import java.util.LinkedHashMap;
import java.util.Map;

public class StepTimer {
    public static final String AGGREGATE = "AGGREGATE";
    public static final String EVALUATE = "EVALUATE";
    public static final String FEATURES = "FEATURES";
    public static final String FIT = "FIT";
    public static final String PREDICT = "PREDICT";
    public static final String MATCH = "MATCH";

    private final Map<String, Long> start = new LinkedHashMap<>();
    private final Map<String, Long> durMs = new LinkedHashMap<>();

    public void start(String step) {
        start.put(step, System.currentTimeMillis());
    }

    public void end(String step) {
        Long s = start.get(step);
        if (s != null) {
            durMs.put(step, System.currentTimeMillis() - s);
        }
    }

    public Map<String, Long> snapshot() {
        return new LinkedHashMap<>(durMs);
    }

    public String summaryText() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Long> e : durMs.entrySet()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(e.getKey().toLowerCase()).append('=').append(e.getValue()).append("ms");
        }
        return sb.toString();
    }
}
