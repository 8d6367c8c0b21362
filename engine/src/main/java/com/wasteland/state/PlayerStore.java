package com.wasteland.state;

import java.util.Optional;
import java.util.function.Function;

/**
 * Keyed store of players with mutual exclusion per wallet.
 *
 * <p>Every read-modify-write of a player goes through {@link #withPlayer}. Two calls for the
 * same wallet never overlap; calls for different wallets never wait on each other.
 */
public interface PlayerStore {

    /**
     * Run {@code action} against the wallet's player while holding that wallet's lock.
     * The player is created with default values on first reference.
     *
     * @param wallet the player key
     * @param action work to do; must not retain the player after returning
     * @param <T>    result type
     * @return whatever {@code action} returns
     */
    <T> T withPlayer(String wallet, Function<Player, T> action);

    /**
     * Summary of an existing player without creating one.
     */
    Optional<PlayerSummary> find(String wallet);

    /**
     * Number of players currently held.
     */
    int size();
}
