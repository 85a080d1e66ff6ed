package com.rymharvest.aggregation;

import com.rymharvest.scraper.EntityStoreInterface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Aggregates every stored entity of one type and writes the batch to a single CSV file.
 */
public class AggregationExporter {
    private static final Logger logger = LoggerFactory.getLogger(AggregationExporter.class);

    private final AggregationContext context;

    public AggregationExporter(AggregationContext context) {
        this.context = context;
    }

    /**
     * Builds an aggregator for the stored entity with the given id.
     * @return the aggregator, or empty if no such entity is stored
     */
    public Optional<Aggregator<?>> aggregatorFor(AggregationType type, int id) {
        EntityStoreInterface store = context.store();
        return switch (type) {
            case ARTIST -> store.findArtistById(id).<Aggregator<?>>map(artist -> new ArtistAggregator(artist, context));
            case ALBUM -> store.findAlbumById(id).<Aggregator<?>>map(album -> new AlbumAggregator(album, context));
            case TRACK -> store.findTrackById(id).<Aggregator<?>>map(track -> new TrackAggregator(track, context));
        };
    }

    /**
     * Aggregates all stored entities of a type, in id order, and writes them to
     * {@code <baseDir>/<type>/<fileName>.csv}. With nothing stored the file holds only the header row.
     * @return number of exported rows
     * @throws IOException if the file cannot be written
     */
    public int export(AggregationType type, boolean normalized, String fileName, String baseDir) throws IOException {
        List<Integer> ids = ids(type);
        List<Aggregation> aggregations = new ArrayList<>();
        Aggregator<?> writer = null;
        for (Integer id : ids) {
            Optional<Aggregator<?>> aggregator = aggregatorFor(type, id);
            if (aggregator.isEmpty()) {
                logger.warn("{} {} disappeared from the store during export", type.key(), id);
                continue;
            }
            aggregations.add(aggregator.get().aggregate(normalized));
            writer = aggregator.get();
        }
        if (writer == null) {
            Path path = Paths.get(baseDir, type.key(), fileName + ".csv");
            context.csvService().writeRows(path, fields(type), List.of());
            logger.info("No stored {} entities to export; wrote header only to {}", type.key(), path);
            return 0;
        }
        writer.writeAggregationsToCsv(aggregations, fileName, baseDir);
        return aggregations.size();
    }

    static List<String> fields(AggregationType type) {
        return switch (type) {
            case ARTIST -> ArtistAggregator.FIELDS;
            case ALBUM -> AlbumAggregator.FIELDS;
            case TRACK -> TrackAggregator.FIELDS;
        };
    }

    private List<Integer> ids(AggregationType type) {
        EntityStoreInterface store = context.store();
        return switch (type) {
            case ARTIST -> store.listArtistIds();
            case ALBUM -> store.listAlbumIds();
            case TRACK -> store.listTrackIds();
        };
    }
}
