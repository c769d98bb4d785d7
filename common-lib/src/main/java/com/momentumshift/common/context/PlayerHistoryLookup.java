package com.momentumshift.common.context;

import com.momentumshift.common.model.PlayerHistory;
import com.momentumshift.common.model.PlayerRole;

import java.time.Instant;

/**
 * External player-history store, called synchronously by the enricher.
 *
 * <p>Implementations return {@code null} or an empty history when the player is
 * unknown, and throw {@link com.momentumshift.common.exception.CollaboratorException}
 * when the store itself fails. They must never block indefinitely; latency is
 * the implementation's concern.
 */
@FunctionalInterface
public interface PlayerHistoryLookup {

    PlayerHistory historyBefore(String playerId, PlayerRole role, Instant before);
}
