package io.irontrade.broker;

/**
 * A trading venue: order execution plus market data.
 * Strategies depend on this type so live and simulated venues are interchangeable.
 */
public interface Environment extends Client, Market {
}
