package com.example.acr.service;

import com.example.acr.model.AcrCriterion;
import com.example.acr.model.AcrDocument;
import com.example.acr.model.ChangeLogEntry;
import com.example.acr.model.ProductInfo;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Field-level diff between two ACR snapshots.
 * <p>
 * Values are recorded as strings (enum codes, labels, ISO instants) so change logs stay
 * readable once stored. Absent values compare as {@code null}; the diff never throws.
 */
@Component
public class ChangeLogGenerator {

    static final String DOCUMENT_FIELD = "document";
    static final String CRITERIA_PREFIX = "criteria.";
    static final String CONFORMANCE_SUFFIX = ".conformanceLevel";
    static final String REMARKS_SUFFIX = ".remarks";
    static final int REMARKS_LIMIT = 100;

    private static final Map<String, Function<ProductInfo, Object>> PRODUCT_FIELDS = productFields();

    public List<ChangeLogEntry> generate(AcrDocument previous, AcrDocument current, String reason) {
        List<ChangeLogEntry> changes = new ArrayList<>();

        if (previous == null) {
            changes.add(new ChangeLogEntry(DOCUMENT_FIELD, null, "created",
                    reason != null ? reason : "Initial version created"));
            return changes;
        }

        compare(changes, "status",
                previous.status() != null ? previous.status().value() : null,
                current.status() != null ? current.status().value() : null, reason);
        compare(changes, "edition",
                previous.edition() != null ? previous.edition().code() : null,
                current.edition() != null ? current.edition().code() : null, reason);

        if (!Objects.equals(previous.productInfo(), current.productInfo())) {
            PRODUCT_FIELDS.forEach((name, getter) -> compare(changes, "productInfo." + name,
                    productValue(previous.productInfo(), getter),
                    productValue(current.productInfo(), getter), reason));
        }

        Map<String, AcrCriterion> before = index(previous.criteria());
        Map<String, AcrCriterion> after = index(current.criteria());

        after.forEach((id, criterion) -> {
            AcrCriterion old = before.get(id);
            if (old == null) {
                changes.add(new ChangeLogEntry(CRITERIA_PREFIX + id, null, "added", reason));
                return;
            }
            compare(changes, CRITERIA_PREFIX + id + CONFORMANCE_SUFFIX,
                    old.conformanceLevel().label(), criterion.conformanceLevel().label(), reason);
            if (!Objects.equals(old.remarks(), criterion.remarks())) {
                changes.add(new ChangeLogEntry(CRITERIA_PREFIX + id + REMARKS_SUFFIX,
                        truncate(old.remarks()), truncate(criterion.remarks()), reason));
            }
        });

        before.keySet().stream()
                .filter(id -> !after.containsKey(id))
                .forEach(id -> changes.add(new ChangeLogEntry(CRITERIA_PREFIX + id, "existed", null,
                        reason != null ? reason : "Criterion removed")));

        return changes;
    }

    /**
     * Criterion id a change entry refers to, or null for document-level fields.
     * Ids contain dots, so only the known attribute suffix is stripped.
     */
    public static String criterionIdOf(String field) {
        if (field == null || !field.startsWith(CRITERIA_PREFIX)) return null;
        String rest = field.substring(CRITERIA_PREFIX.length());
        if (rest.endsWith(CONFORMANCE_SUFFIX)) {
            return rest.substring(0, rest.length() - CONFORMANCE_SUFFIX.length());
        }
        if (rest.endsWith(REMARKS_SUFFIX)) {
            return rest.substring(0, rest.length() - REMARKS_SUFFIX.length());
        }
        return rest;
    }

    static String truncate(String value) {
        if (value == null) return null;
        return value.length() > REMARKS_LIMIT ? value.substring(0, REMARKS_LIMIT) + "..." : value;
    }

    private static void compare(List<ChangeLogEntry> changes, String field, Object before, Object after,
                                String reason) {
        if (!Objects.equals(before, after)) {
            changes.add(new ChangeLogEntry(field, before, after, reason));
        }
    }

    private static Object productValue(ProductInfo info, Function<ProductInfo, Object> getter) {
        return info != null ? getter.apply(info) : null;
    }

    private static Map<String, AcrCriterion> index(List<AcrCriterion> criteria) {
        Map<String, AcrCriterion> index = new LinkedHashMap<>();
        if (criteria != null) {
            criteria.forEach(c -> index.put(c.id(), c));
        }
        return index;
    }

    private static Map<String, Function<ProductInfo, Object>> productFields() {
        Map<String, Function<ProductInfo, Object>> fields = new LinkedHashMap<>();
        fields.put("name", ProductInfo::name);
        fields.put("version", ProductInfo::version);
        fields.put("description", ProductInfo::description);
        fields.put("vendor", ProductInfo::vendor);
        fields.put("contactEmail", ProductInfo::contactEmail);
        fields.put("evaluationDate", p -> p.evaluationDate() != null ? p.evaluationDate().toString() : null);
        return fields;
    }
}
