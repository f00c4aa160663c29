package org.iceforge.terra.gateway.service;

import org.iceforge.terra.gateway.config.TerraProperties;
import org.iceforge.terra.gateway.engine.QueryEngine;
import org.iceforge.terra.gateway.entity.CoverageIndex;
import org.iceforge.terra.gateway.entity.GeoLevel;
import org.iceforge.terra.gateway.model.DatasetDescriptor;
import org.iceforge.terra.gateway.sql.Identifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the {@link CoverageIndex} from the distinct place names of every columnar dataset.
 * The index is built once and kept until restart. It is warmed in the background when the
 * application is ready, so requests do not normally pay for the build.
 */
@Component
public class CoverageIndexProvider {

    private static final Logger log = LoggerFactory.getLogger(CoverageIndexProvider.class);

    private final DatasetCatalog catalog;
    private final QueryEngine engine;
    private final TerraProperties props;

    private volatile CoverageIndex cached;

    public CoverageIndexProvider(DatasetCatalog catalog, QueryEngine engine, TerraProperties props) {
        this.catalog = Objects.requireNonNull(catalog);
        this.engine = Objects.requireNonNull(engine);
        this.props = Objects.requireNonNull(props);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void warmUp() {
        Mono.fromCallable(this::coverage)
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(props.getQuery().getExecutionTimeout())
                .subscribe(index -> log.debug("Coverage index ready"),
                        e -> log.warn("Coverage index warm-up did not finish, will build on first use: {}", e.toString()));
    }

    public CoverageIndex coverage() {
        CoverageIndex local = cached;
        if (local != null) return local;

        synchronized (this) {
            if (cached != null) return cached;
            cached = build();
            return cached;
        }
    }

    private CoverageIndex build() {
        CoverageIndex.Builder builder = CoverageIndex.builder();
        int datasets = 0;
        for (DatasetDescriptor d : catalog.all()) {
            if (!d.isColumnar() || d.tableName() == null) {
                continue;
            }
            try {
                Identifier table = Identifier.table(d.tableName());
                Map<GeoLevel, List<String>> found = new EnumMap<>(GeoLevel.class);
                for (GeoLevel level : GeoLevel.values()) {
                    if (d.hasColumn(level.column())) {
                        found.put(level, distinct(table, Identifier.column(level.column())));
                    }
                }
                found.forEach(builder::add);
                datasets++;
            } catch (RuntimeException e) {
                log.warn("Skipping {} while building coverage index: {}", d.getFileId(), e.getMessage());
            }
        }
        CoverageIndex index = builder.build();
        log.info("Coverage index built from {} datasets: {} countries, {} admin1 regions, {} cities",
                datasets, index.names(GeoLevel.COUNTRY).size(), index.names(GeoLevel.ADMIN1).size(),
                index.names(GeoLevel.CITY).size());
        return index;
    }

    private List<String> distinct(Identifier table, Identifier column) {
        String sql = "SELECT DISTINCT " + column.quoted() + " FROM " + table.quoted()
                + " WHERE " + column.quoted() + " IS NOT NULL";
        List<String> names = new ArrayList<>();
        for (Map<String, Object> row : engine.execute(sql, List.of())) {
            Object v = row.values().iterator().next();
            if (v != null) {
                names.add(v.toString());
            }
        }
        return names;
    }
}
