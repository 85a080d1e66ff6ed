package com.rymharvest.aggregation;

import com.rymharvest.scraper.ArtistEntity;
import com.rymharvest.scraper.GenreEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * Aggregates the RYM facts of a single artist. Genres are reloaded from the store when the artist was
 * loaded without them.
 */
public class ArtistAggregator extends Aggregator<ArtistEntity> {
    private static final Logger logger = LoggerFactory.getLogger(ArtistAggregator.class);

    public static final List<String> FIELDS = List.of(
        "active",
        "discographySize",
        "artistLists",
        "members",
        "shows",
        "soloPerformer",
        "genreCount"
    );

    static final Map<String, DoubleUnaryOperator> NORMALIZERS = Map.of(
        "active", Normalizers.unit(),
        "discographySize", Normalizers.logScale(500),
        "artistLists", Normalizers.logScale(5_000),
        "members", Normalizers.range(0, 20),
        "shows", Normalizers.logScale(3_000),
        "soloPerformer", Normalizers.unit(),
        "genreCount", Normalizers.range(0, 10)
    );

    public ArtistAggregator(ArtistEntity artist, AggregationContext context) {
        super(artist, AggregationType.ARTIST, context);
    }

    @Override
    protected Integer entityId() {
        return entity.id();
    }

    @Override
    protected Aggregation generateAggregate(boolean normalized) {
        return template(0)
            .with("active", entity.active() ? 1 : 0)
            .with("discographySize", entity.discographyCountRym())
            .with("artistLists", entity.listCountRym())
            .with("members", entity.memberCount())
            .with("shows", entity.showCountRym())
            .with("soloPerformer", entity.soloPerformer() ? 1 : 0)
            .with("genreCount", genres().size());
    }

    private List<GenreEntity> genres() {
        if (entity.genres() != null) return entity.genres();
        if (entity.id() == null) {
            logger.warn("Artist {} has no genres loaded and no id to load them with", entity.urlRym());
            return List.of();
        }
        return context.store().findArtistById(entity.id())
            .map(ArtistEntity::genres)
            .orElseGet(() -> {
                logger.warn("Artist {} not found in store while loading genres", entity.id());
                return List.of();
            });
    }

    @Override
    protected Map<String, DoubleUnaryOperator> normalizers() {
        return NORMALIZERS;
    }

    @Override
    public Aggregation template(double defaultVal) {
        return Aggregation.filled(AggregationType.ARTIST, FIELDS, defaultVal);
    }
}
