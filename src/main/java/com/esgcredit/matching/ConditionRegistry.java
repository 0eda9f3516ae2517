package com.esgcredit.matching;

import com.esgcredit.core.ConfigurationException;
import com.esgcredit.core.ValidationException;
import com.esgcredit.matching.ConditionDefinition.Comparison;
import com.esgcredit.matching.ConditionDefinition.Source;
import com.esgcredit.model.Pillar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 模块说明：ConditionRegistry（class）。
 * 主要职责：登记每个资格条件名对应的取值来源与比较方向（min_ 为 ≥，max_ 为 ≤）。
 * 使用建议：条件语义只由此登记表决定，不从名称推断；登记表错误在启动时抛出 ConfigurationException。
 * 数值条件的阈值与被比较的取值同在 0..100 刻度上：分数、归一化后的子指标（min_renewable_ratio 比较的是
 * 归一化值，原始比例 0.3 对应阈值 30）、供应链扣分与合规比例。
 */
public final class ConditionRegistry {
    private final Map<String, ConditionDefinition> definitions;

    public ConditionRegistry(List<ConditionDefinition> definitions) {
        Map<String, ConditionDefinition> out = new LinkedHashMap<>();
        for (ConditionDefinition def : definitions) {
            if (def == null || def.name == null || def.name.trim().isEmpty()) {
                throw new ConfigurationException("condition.registry", "condition without a name");
            }
            if (def.comparison == null || def.source == null) {
                throw new ConfigurationException(def.name, "condition needs a comparison and a source");
            }
            if (def.name.startsWith("min_") && def.comparison != Comparison.AT_LEAST) {
                throw new ConfigurationException(def.name, "min_ condition must compare with >=");
            }
            if (def.name.startsWith("max_") && def.comparison != Comparison.AT_MOST) {
                throw new ConfigurationException(def.name, "max_ condition must compare with <=");
            }
            if ((def.source == Source.SEGMENT) != (def.comparison == Comparison.ANY_OF)) {
                throw new ConfigurationException(def.name, "segment conditions and only they compare with any-of");
            }
            if (def.source == Source.INDICATOR && (def.indicatorKey == null || def.indicatorKey.isEmpty())) {
                throw new ConfigurationException(def.name, "indicator condition without indicator key");
            }
            if (out.put(def.name, def) != null) {
                throw new ConfigurationException(def.name, "duplicate condition name");
            }
        }
        this.definitions = Collections.unmodifiableMap(out);
    }

    public static ConditionRegistry standard() {
        List<ConditionDefinition> defs = new ArrayList<>();
        for (Pillar pillar : Pillar.values()) {
            String code = pillar.code().toLowerCase(Locale.ROOT);
            defs.add(new ConditionDefinition("min_" + code + "_score", Comparison.AT_LEAST, Source.CURRENT_SCORE, pillar, null));
        }
        defs.add(new ConditionDefinition("min_total_score", Comparison.AT_LEAST, Source.CURRENT_SCORE, null, null));
        defs.add(new ConditionDefinition("min_grade", Comparison.AT_LEAST, Source.GRADE, null, null));
        defs.add(new ConditionDefinition("min_renewable_ratio", Comparison.AT_LEAST, Source.INDICATOR, Pillar.ENVIRONMENTAL,
                "environmental.renewable_energy_ratio"));
        defs.add(new ConditionDefinition("max_supply_chain_penalty", Comparison.AT_MOST, Source.SCOPE_ADJUSTMENT, null, null));
        defs.add(new ConditionDefinition("min_compliance_ratio", Comparison.AT_LEAST, Source.COMPLIANCE_RATIO, null, null));
        defs.add(new ConditionDefinition("target_segments", Comparison.ANY_OF, Source.SEGMENT, null, null));
        for (Pillar pillar : Pillar.values()) {
            String code = pillar.code().toLowerCase(Locale.ROOT);
            defs.add(new ConditionDefinition("projected_" + code + "_score", Comparison.AT_LEAST, Source.PROJECTED_SCORE, pillar, null));
        }
        defs.add(new ConditionDefinition("projected_total_score", Comparison.AT_LEAST, Source.PROJECTED_SCORE, null, null));
        return new ConditionRegistry(defs);
    }

    public Optional<ConditionDefinition> find(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public ConditionDefinition require(String subject, String name) {
        ConditionDefinition def = definitions.get(name);
        if (def == null) {
            throw new ValidationException(subject, "unknown eligibility condition: " + name);
        }
        return def;
    }

    public List<String> names() {
        return List.copyOf(definitions.keySet());
    }
}
