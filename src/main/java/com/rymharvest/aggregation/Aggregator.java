package com.rymharvest.aggregation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

/**
 * Superclass for all data aggregators. Turns a stored entity into a fixed-shape {@link Aggregation}.
 * <p>
 * Workflow of {@link #aggregate(boolean)}:
 * <ul>
 *   <li>Derives the cache key from the aggregation type, the entity id and the normalisation flag.
 *   Entities without an id are never cached.</li>
 *   <li>Returns a cached aggregation as is.</li>
 *   <li>Otherwise generates the aggregation, loading relations from the store when the entity does not
 *   carry them, normalises it when asked, caches it and returns it.</li>
 * </ul>
 * Cached aggregations are not invalidated when the stored entity's relations change later; they live until
 * the cache evicts them.
 * <p>
 * Aggregators hold their entity with all loaded relations, so keep them short-lived.
 *
 * @param <E> entity the aggregation is built from
 * @author RYM Harvest Team
 * @since 1.0
 */
public abstract class Aggregator<E> {
    private static final Logger logger = LoggerFactory.getLogger(Aggregator.class);
    public static final String DEFAULT_FILE_NAME = "data";
    public static final String DEFAULT_BASE_DIR = "./resources/data";

    protected final E entity;
    protected final AggregationType aggregationType;
    protected final AggregationContext context;

    protected Aggregator(E entity, AggregationType aggregationType, AggregationContext context) {
        if (entity == null) throw new IllegalArgumentException(aggregationType.key() + " aggregator requires an entity");
        this.entity = entity;
        this.aggregationType = aggregationType;
        this.context = context;
    }

    public Aggregation aggregate() {
        return aggregate(true);
    }

    /**
     * High-level aggregation entry point used by all aggregators.
     * @param normalized if values should be scaled onto [0, 1] with {@link #normalize(Aggregation)}
     * @return the aggregation, from cache when available
     */
    public Aggregation aggregate(boolean normalized) {
        String key = redisKey(normalized);
        if (key != null) {
            Optional<Aggregation> cached = context.cache().getObject(key, Aggregation.class);
            if (cached.isPresent()) return cached.get();
        }
        Aggregation aggregation = generateAggregate(normalized);
        if (!aggregation.fields().equals(fields())) {
            throw new IllegalStateException(aggregationType.key() + " aggregation does not match its template: "
                + aggregation.fields());
        }
        if (normalized) aggregation = normalize(aggregation);
        if (key != null) context.cache().setObject(key, aggregation);
        return aggregation;
    }

    /**
     * Values of an aggregation in field order, without labels.
     */
    public static List<Double> stripLabels(Aggregation aggregation) {
        return new ArrayList<>(aggregation.getValues().values());
    }

    /**
     * CSV header row; one column per field.
     */
    public String[] csvHeaders() {
        return fields().toArray(String[]::new);
    }

    public void writeAggregationsToCsv(List<Aggregation> aggregations) throws IOException {
        writeAggregationsToCsv(aggregations, DEFAULT_FILE_NAME, DEFAULT_BASE_DIR);
    }

    /**
     * Writes aggregations of this aggregator's type to {@code <baseDir>/<type>/<fileName>.csv}.
     * @param aggregations aggregations in row order
     * @param fileName file name without extension
     * @param baseDir base export directory
     * @throws IOException if the file cannot be written
     */
    public void writeAggregationsToCsv(List<Aggregation> aggregations, String fileName, String baseDir) throws IOException {
        List<List<Double>> rows = new ArrayList<>();
        for (Aggregation aggregation : aggregations) {
            if (aggregation.getType() != aggregationType) {
                throw new IllegalArgumentException("Cannot write a " + aggregation.getType().key() + " aggregation to the "
                    + aggregationType.key() + " export");
            }
            rows.add(stripLabels(aggregation));
        }
        Path path = Paths.get(baseDir, aggregationType.key(), fileName + ".csv");
        context.csvService().writeRows(path, fields(), rows);
        logger.info("Exported {} {} aggregations to {}", rows.size(), aggregationType.key(), path);
    }

    /**
     * Field names of this aggregation type, in order.
     */
    public List<String> fields() {
        return template(0).fields();
    }

    /**
     * Cache key for this entity's aggregation, or null when the entity has no id yet.
     */
    public String redisKey(boolean normalized) {
        Integer id = entityId();
        if (id == null) return null;
        String keyString = aggregationType.key() + "_" + id;
        if (normalized) return keyString + "_normalized";
        return keyString;
    }

    public AggregationType getAggregationType() {
        return aggregationType;
    }

    protected abstract Integer entityId();

    /**
     * Builds the raw aggregation. Implementations first make sure every relation they need is loaded,
     * fetching it from the store if the entity does not carry it, then fill every template field.
     * @param normalized whether the caller will normalise the result
     */
    protected abstract Aggregation generateAggregate(boolean normalized);

    /**
     * Scaling rule per field.
     */
    protected abstract Map<String, DoubleUnaryOperator> normalizers();

    /**
     * Scales every value onto [0, 1] with this type's rules.
     */
    protected Aggregation normalize(Aggregation aggregation) {
        Map<String, DoubleUnaryOperator> rules = normalizers();
        return aggregation.map((field, value) -> {
            DoubleUnaryOperator rule = rules.get(field);
            if (rule == null) throw new IllegalStateException("No normalisation rule for " + aggregationType.key() + "." + field);
            return rule.applyAsDouble(value);
        });
    }

    /**
     * Blank aggregation of this type with every field set to {@code defaultVal}.
     */
    public abstract Aggregation template(double defaultVal);
}
