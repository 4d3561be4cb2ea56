package io.irontrade.infrastructure.data;

import io.irontrade.application.port.output.BarDataSource;
import io.irontrade.domain.data.Bar;
import io.irontrade.domain.model.AssetPair;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * BarDataSource over bars held in memory, keyed by pair and start time.
 *
 * A query returns the latest bar starting at or before the requested instant,
 * regardless of the requested bar duration.
 */
public class InMemoryBarDataSource implements BarDataSource {

    private final Map<AssetPair, NavigableMap<Instant, Bar>> bars = new ConcurrentHashMap<>();

    public InMemoryBarDataSource() {
    }

    public InMemoryBarDataSource(AssetPair assetPair, Collection<Bar> bars) {
        addBars(assetPair, bars);
    }

    public synchronized void addBar(AssetPair assetPair, Bar bar) {
        bars.computeIfAbsent(assetPair, k -> new TreeMap<>()).put(bar.dateTime(), bar);
    }

    public synchronized void addBars(AssetPair assetPair, Collection<Bar> newBars) {
        for (Bar bar : newBars) {
            addBar(assetPair, bar);
        }
    }

    @Override
    public synchronized Optional<Bar> getBar(AssetPair assetPair, Instant at, Duration barDuration) {
        NavigableMap<Instant, Bar> series = bars.get(assetPair);
        if (series == null) {
            return Optional.empty();
        }
        Map.Entry<Instant, Bar> entry = series.floorEntry(at);
        return entry == null ? Optional.empty() : Optional.of(entry.getValue());
    }

    public synchronized List<Bar> getBars(AssetPair assetPair) {
        NavigableMap<Instant, Bar> series = bars.get(assetPair);
        return series == null ? List.of() : List.copyOf(series.values());
    }
}
