package com.rymharvest.aggregation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Immutable, fixed-shape numeric record: an ordered mapping from field name to value.
 * <p>
 * An aggregation is created from a field list and afterwards only its values change, so every aggregation
 * derived from a template has the template's keys in the template's order. Serialised with Jackson
 * for the aggregation cache.
 */
public final class Aggregation {
    private final AggregationType type;
    private final LinkedHashMap<String, Double> values;

    @JsonCreator
    public Aggregation(@JsonProperty("type") AggregationType type,
                       @JsonProperty("values") Map<String, Double> values) {
        this.type = Objects.requireNonNull(type, "type");
        if (values == null || values.isEmpty()) throw new IllegalArgumentException("Aggregation needs at least one field");
        this.values = new LinkedHashMap<>(values);
    }

    /**
     * Creates an aggregation with every field set to {@code defaultVal}.
     */
    public static Aggregation filled(AggregationType type, List<String> fields, double defaultVal) {
        LinkedHashMap<String, Double> values = new LinkedHashMap<>();
        for (String field : fields) values.put(field, defaultVal);
        return new Aggregation(type, values);
    }

    @JsonProperty("type")
    public AggregationType getType() {
        return type;
    }

    @JsonProperty("values")
    public Map<String, Double> getValues() {
        return Collections.unmodifiableMap(values);
    }

    public List<String> fields() {
        return new ArrayList<>(values.keySet());
    }

    public double get(String field) {
        Double value = values.get(field);
        if (value == null) throw new IllegalArgumentException(type.key() + " aggregation has no field " + field);
        return value;
    }

    /**
     * Returns a copy with one field changed.
     * @throws IllegalArgumentException if the field is not part of this aggregation's shape
     */
    public Aggregation with(String field, double value) {
        if (!values.containsKey(field)) {
            throw new IllegalArgumentException(type.key() + " aggregation has no field " + field);
        }
        LinkedHashMap<String, Double> copy = new LinkedHashMap<>(values);
        copy.put(field, value);
        return new Aggregation(type, copy);
    }

    /**
     * Returns a copy with every value replaced by {@code mapper(field, value)}, keeping the field order.
     */
    public Aggregation map(BiFunction<String, Double, Double> mapper) {
        LinkedHashMap<String, Double> copy = new LinkedHashMap<>();
        values.forEach((field, value) -> copy.put(field, mapper.apply(field, value)));
        return new Aggregation(type, copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Aggregation other)) return false;
        return type == other.type && values.equals(other.values) && fields().equals(other.fields());
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, values);
    }

    @Override
    public String toString() {
        return type.key() + values;
    }
}
