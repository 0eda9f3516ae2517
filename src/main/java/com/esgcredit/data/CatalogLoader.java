package com.esgcredit.data;

import com.esgcredit.core.ValidationException;
import com.esgcredit.core.diagnostics.CauseCode;
import com.esgcredit.core.diagnostics.Outcome;
import com.esgcredit.matching.ConditionDefinition;
import com.esgcredit.matching.ConditionRegistry;
import com.esgcredit.model.CompanyProfile;
import com.esgcredit.model.EligibilityCondition;
import com.esgcredit.model.Grade;
import com.esgcredit.model.HistoricalSeries;
import com.esgcredit.model.IndicatorRecord;
import com.esgcredit.model.Pillar;
import com.esgcredit.model.ProductSpec;
import com.esgcredit.model.ProjectionMode;
import com.esgcredit.model.SeriesPoint;
import com.esgcredit.model.SupplierRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * 模块说明：CatalogLoader（class）。
 * 主要职责：读取企业目录与金融产品目录（JSON），转换为不可变的领域对象。
 * 使用建议：格式错误的条目抛出 ValidationException 并带上条目标识；文件读取失败抛出 IOException。
 */
public final class CatalogLoader {
    private static final Logger LOG = LogManager.getLogger(CatalogLoader.class);

    private final ConditionRegistry registry;

    public CatalogLoader(ConditionRegistry registry) {
        this.registry = registry;
    }

    /**
     * All companies of the catalog; the first malformed entry fails the whole load.
     */
    public List<CompanyProfile> loadCompanies(Path path) throws IOException {
        List<CompanyProfile> companies = parseCompanies(Files.readString(path, StandardCharsets.UTF_8));
        LOG.info("loaded {} companies from {}", companies.size(), path);
        return companies;
    }

    /**
     * One outcome per catalog entry, so a malformed company is reported without dropping the rest.
     */
    public List<Outcome<CompanyProfile>> loadCompanyEntries(Path path) throws IOException {
        List<Outcome<CompanyProfile>> entries = parseCompanyEntries(Files.readString(path, StandardCharsets.UTF_8));
        long rejected = entries.stream().filter(Outcome::failed).count();
        LOG.info("loaded {} company entries from {} (rejected={})", entries.size(), path, rejected);
        return entries;
    }

    public List<ProductSpec> loadProducts(Path path) throws IOException {
        List<ProductSpec> products = parseProducts(Files.readString(path, StandardCharsets.UTF_8));
        LOG.info("loaded {} products from {}", products.size(), path);
        return products;
    }

    public List<CompanyProfile> parseCompanies(String json) {
        List<CompanyProfile> out = new ArrayList<>();
        for (Outcome<CompanyProfile> entry : parseCompanyEntries(json)) {
            if (entry.failed()) {
                throw new ValidationException(entry.owner, entry.message);
            }
            out.add(entry.value);
        }
        return out;
    }

/**
 * 方法说明：parseCompanyEntries，负责逐条解析企业目录。
 * 处理流程：顶层可为数组或带 companies 字段的对象；每个企业包含基本信息、E/S/G 指标、合规声明、月度历史与供应商。
 * 维护提示：单个条目格式错误只产生该条目的 VALIDATION_FAILED 结果，不影响其余企业；整个文件不是合法 JSON 时仍抛出 ValidationException。
 */
    public List<Outcome<CompanyProfile>> parseCompanyEntries(String json) {
        JSONArray array = rootArray(json, "companies");
        List<Outcome<CompanyProfile>> out = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            JSONObject item = array.optJSONObject(i);
            String subject = item == null ? "companies[" + i + "]" : item.optString("name", "companies[" + i + "]").trim();
            if (subject.isEmpty()) {
                subject = "companies[" + i + "]";
            }
            if (item == null) {
                out.add(rejected(subject, i, "company entry is not an object"));
                continue;
            }
            try {
                out.add(Outcome.success(parseCompany(item), subject));
            } catch (JSONException | DateTimeParseException | IllegalArgumentException e) {
                out.add(rejected(subject, i, "malformed company entry: " + e.getMessage()));
            } catch (ValidationException e) {
                out.add(rejected(subject, i, e.getMessage()));
            }
        }
        return out;
    }

    private static Outcome<CompanyProfile> rejected(String subject, int index, String message) {
        LOG.warn("company entry rejected: {} {}", subject, message);
        return Outcome.failure(CauseCode.VALIDATION_FAILED, subject, message, Map.of(
                "subject", subject,
                "entry", index
        ));
    }

    public List<ProductSpec> parseProducts(String json) {
        JSONArray array = rootArray(json, "products");
        List<ProductSpec> out = new ArrayList<>(array.length());
        TreeSet<String> ids = new TreeSet<>();
        for (int i = 0; i < array.length(); i++) {
            JSONObject item = array.optJSONObject(i);
            String subject = item == null ? "products[" + i + "]" : item.optString("id", "products[" + i + "]");
            if (item == null) {
                throw new ValidationException(subject, "product entry is not an object");
            }
            ProductSpec product;
            try {
                product = parseProduct(item);
            } catch (JSONException | IllegalArgumentException e) {
                throw new ValidationException(subject, "malformed product entry: " + e.getMessage(), e);
            }
            if (!ids.add(product.id)) {
                throw new ValidationException(product.id, "duplicate product id");
            }
            out.add(product);
        }
        return out;
    }

    private CompanyProfile parseCompany(JSONObject item) {
        String name = item.getString("name").trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("blank company name");
        }
        IndicatorRecord indicators = IndicatorRecord.builder()
                .name(name)
                .industry(item.optString("industry", ""))
                .sizeClass(item.optString("size", ""))
                .environmental(indicatorMap(item.optJSONObject(Pillar.ENVIRONMENTAL.key())))
                .social(indicatorMap(item.optJSONObject(Pillar.SOCIAL.key())))
                .governance(indicatorMap(item.optJSONObject(Pillar.GOVERNANCE.key())))
                .compliance(complianceMap(item.optJSONObject("compliance")))
                .build();

        List<SeriesPoint> points = new ArrayList<>();
        JSONArray history = item.optJSONArray("history");
        if (history != null) {
            for (int i = 0; i < history.length(); i++) {
                JSONObject p = history.getJSONObject(i);
                points.add(new SeriesPoint(
                        YearMonth.parse(p.getString("period").trim()),
                        p.getDouble(Pillar.ENVIRONMENTAL.code()),
                        p.getDouble(Pillar.SOCIAL.code()),
                        p.getDouble(Pillar.GOVERNANCE.code())
                ));
            }
        }

        List<SupplierRecord> suppliers = new ArrayList<>();
        JSONArray supplierArray = item.optJSONArray("suppliers");
        if (supplierArray != null) {
            for (int i = 0; i < supplierArray.length(); i++) {
                JSONObject s = supplierArray.getJSONObject(i);
                suppliers.add(new SupplierRecord(
                        s.getString("id"),
                        s.getDouble("emissions"),
                        s.getDouble("esg_score"),
                        s.optDouble("weight", 1.0)
                ));
            }
        }

        return CompanyProfile.builder()
                .indicators(indicators)
                .history(new HistoricalSeries(name, points))
                .suppliers(List.copyOf(suppliers))
                .targetLoanAmount(item.optDouble("target_loan_amount", 0.0))
                .build();
    }

    private ProductSpec parseProduct(JSONObject item) {
        String id = item.getString("id").trim();
        if (id.isEmpty()) {
            throw new IllegalArgumentException("blank product id");
        }
        List<EligibilityCondition> conditions = new ArrayList<>();
        JSONObject raw = item.optJSONObject("conditions");
        if (raw != null) {
            for (String name : new TreeSet<>(raw.keySet())) {
                ConditionDefinition def = registry.require(id, name);
                conditions.add(parseCondition(def, raw.get(name)));
            }
        }

        Map<Grade, Double> gradeDiscounts = new EnumMap<>(Grade.class);
        JSONObject discounts = item.optJSONObject("grade_discounts");
        if (discounts != null) {
            for (String label : discounts.keySet()) {
                double d = discounts.getDouble(label);
                if (!Double.isFinite(d) || d < 0.0) {
                    throw new IllegalArgumentException("grade discount for " + label + " must be >= 0");
                }
                gradeDiscounts.put(Grade.fromLabel(label), d);
            }
        }

        return ProductSpec.builder()
                .id(id)
                .name(item.optString("name", id))
                .type(item.optString("type", ""))
                .baseRate(item.getDouble("base_rate"))
                .esgDiscount(item.optBoolean("esg_discount", false))
                .conditions(List.copyOf(conditions))
                .gradeDiscounts(gradeDiscounts.isEmpty() ? Map.of() : Map.copyOf(gradeDiscounts))
                .build();
    }

    private static EligibilityCondition parseCondition(ConditionDefinition def, Object value) {
        if (def.source == ConditionDefinition.Source.GRADE) {
            return EligibilityCondition.minGrade(def.name, Grade.fromLabel(String.valueOf(value)));
        }
        if (def.source == ConditionDefinition.Source.SEGMENT) {
            return EligibilityCondition.segments(def.name, segmentList(def.name, value));
        }
        if (value instanceof JSONObject) {
            JSONObject obj = (JSONObject) value;
            double threshold = checkedThreshold(def.name, obj.getDouble("threshold"));
            ProjectionMode mode = ProjectionMode.fromText(obj.optString("mode", ""));
            return EligibilityCondition.projected(def.name, threshold, mode);
        }
        double threshold = checkedThreshold(def.name, toDouble(value));
        if (def.projected()) {
            return EligibilityCondition.projected(def.name, threshold, ProjectionMode.FINAL_STEP);
        }
        return EligibilityCondition.numeric(def.name, threshold);
    }

    /**
     * Numeric conditions compare values on the 0..100 score scale; a ratio written as 0.3 would pass trivially.
     */
    private static double checkedThreshold(String name, double threshold) {
        if (!Double.isFinite(threshold) || threshold < 0.0 || threshold > 100.0) {
            throw new IllegalArgumentException(name + " threshold must be within [0, 100], got " + threshold);
        }
        return threshold;
    }

    private static List<String> segmentList(String name, Object value) {
        List<String> out = new ArrayList<>();
        if (value instanceof JSONArray) {
            JSONArray array = (JSONArray) value;
            for (int i = 0; i < array.length(); i++) {
                out.add(array.getString(i).trim());
            }
        } else if (value instanceof String) {
            out.add(((String) value).trim());
        } else {
            throw new IllegalArgumentException(name + " must list segment names, got " + value);
        }
        out.removeIf(String::isEmpty);
        if (out.isEmpty()) {
            throw new IllegalArgumentException(name + " lists no segment");
        }
        return out;
    }

    private static Map<String, Boolean> complianceMap(JSONObject obj) {
        Map<String, Boolean> out = new LinkedHashMap<>();
        if (obj == null) {
            return out;
        }
        for (String key : new TreeSet<>(obj.keySet())) {
            Object value = obj.get(key);
            if (!(value instanceof Boolean)) {
                throw new IllegalArgumentException("compliance." + key + " must be true or false, got " + value);
            }
            out.put(key, (Boolean) value);
        }
        return out;
    }

    private static Map<String, Double> indicatorMap(JSONObject obj) {
        Map<String, Double> out = new LinkedHashMap<>();
        if (obj == null) {
            return out;
        }
        for (String key : new TreeSet<>(obj.keySet())) {
            Object value = obj.get(key);
            out.put(key, JSONObject.NULL.equals(value) ? null : toDouble(value));
        }
        return out;
    }

    private static double toDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw new IllegalArgumentException("not a number: " + value);
    }

    private static JSONArray rootArray(String json, String field) {
        try {
            String trimmed = json == null ? "" : json.trim();
            if (trimmed.startsWith("[")) {
                return new JSONArray(trimmed);
            }
            JSONObject root = new JSONObject(trimmed);
            JSONArray array = root.optJSONArray(field);
            if (array == null) {
                throw new ValidationException(field, "catalog has no '" + field + "' array");
            }
            return array;
        } catch (JSONException e) {
            throw new ValidationException(field, "catalog is not valid JSON: " + e.getMessage(), e);
        }
    }
}
