package io.irontrade.broker;

import io.irontrade.domain.data.Bar;
import io.irontrade.domain.model.AssetPair;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Market data access.
 */
public interface Market {

    Duration ONE_MINUTE = Duration.ofMinutes(1);

    /**
     * Get the latest completed bar for a pair.
     *
     * @param assetPair Pair to query
     * @param barDuration Bar window length
     * @return CompletableFuture with the bar, or empty if none has closed yet
     */
    CompletableFuture<Optional<Bar>> getLatestBar(AssetPair assetPair, Duration barDuration);

    default CompletableFuture<Optional<Bar>> getLatestMinuteBar(AssetPair assetPair) {
        return getLatestBar(assetPair, ONE_MINUTE);
    }
}
