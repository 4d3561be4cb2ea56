package io.irontrade.application.port.output;

import io.irontrade.domain.data.Bar;
import io.irontrade.domain.model.AssetPair;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Port for historical bar data.
 */
public interface BarDataSource {

    /**
     * Get the bar in effect for a pair at a point in time.
     *
     * @param assetPair Pair to query
     * @param at Point in time
     * @param barDuration Bar window length
     * @return the bar, or empty if there is no data at that time
     * @throws io.irontrade.broker.exception.BarDataSourceException if the data cannot be read
     */
    Optional<Bar> getBar(AssetPair assetPair, Instant at, Duration barDuration);
}
