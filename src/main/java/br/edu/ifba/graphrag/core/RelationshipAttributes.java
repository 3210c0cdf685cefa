package br.edu.ifba.graphrag.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Attributes attached to a relationship.
 *
 * <p>The keys used by the renderer have typed fields. Unknown keys are kept as
 * strings in {@code extra} so seed data can grow without code changes.</p>
 *
 * @param year    year the relationship started (e.g. founding year)
 * @param amount  monetary amount, already formatted (e.g. {@code $13B})
 * @param role    role held, meaningful for {@code leads}
 * @param product product involved, meaningful for {@code supplies}
 * @param type    qualifier of the relationship (e.g. {@code strategic})
 * @param extra   any other attribute
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RelationshipAttributes(
    @Nullable Integer year,
    @Nullable String amount,
    @Nullable String role,
    @Nullable String product,
    @Nullable String type,
    @JsonProperty("extra") @NotNull Map<String, String> extra
) {

    public static final RelationshipAttributes EMPTY =
        new RelationshipAttributes(null, null, null, null, null, Map.of());

    public RelationshipAttributes {
        extra = extra != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(extra))
            : Collections.emptyMap();
    }

    /**
     * Builds attributes from an untyped map as found in seed data.
     *
     * @param raw the attribute map, may be null
     * @return typed attributes
     * @throws IllegalArgumentException if {@code year} is not an integer
     */
    @NotNull
    public static RelationshipAttributes fromMap(@Nullable Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }

        Integer year = null;
        String amount = null;
        String role = null;
        String product = null;
        String type = null;
        Map<String, String> extra = new LinkedHashMap<>();

        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            switch (entry.getKey()) {
                case "year" -> year = toYear(value);
                case "amount" -> amount = value.toString();
                case "role" -> role = value.toString();
                case "product" -> product = value.toString();
                case "type" -> type = value.toString();
                default -> extra.put(entry.getKey(), value.toString());
            }
        }

        return new RelationshipAttributes(year, amount, role, product, type, extra);
    }

    private static Integer toYear(Object value) {
        if (value instanceof Number number) {
            double asDouble = number.doubleValue();
            if (asDouble != Math.rint(asDouble) || asDouble < Integer.MIN_VALUE || asDouble > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("year must be an integer, got: " + value);
            }
            return number.intValue();
        }
        try {
            return Integer.valueOf(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("year must be an integer, got: " + value, e);
        }
    }

    /**
     * Returns every present attribute as a flat map, typed keys first.
     */
    @NotNull
    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        if (year != null) map.put("year", year.toString());
        if (amount != null) map.put("amount", amount);
        if (role != null) map.put("role", role);
        if (product != null) map.put("product", product);
        if (type != null) map.put("type", type);
        map.putAll(extra);
        return map;
    }
}
