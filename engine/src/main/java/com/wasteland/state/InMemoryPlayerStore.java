package com.wasteland.state;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Player store backed by a concurrent map. Contents are lost on restart.
 *
 * <p>Locks live in a weak-valued Guava cache: a wallet's lock stays alive while any thread
 * holds a reference to it and is collected once the wallet goes idle.
 */
@Slf4j
public class InMemoryPlayerStore implements PlayerStore {

    private final ConcurrentMap<String, Player> players = new ConcurrentHashMap<>();

    private final Cache<String, ReentrantLock> locks = CacheBuilder.newBuilder()
            .weakValues()
            .build();

    public InMemoryPlayerStore() {
        log.info("InMemoryPlayerStore initialized");
    }

    @Override
    public <T> T withPlayer(String wallet, Function<Player, T> action) {
        ReentrantLock lock = lockFor(wallet);
        lock.lock();
        try {
            Player player = players.computeIfAbsent(wallet, this::loadOrCreate);
            try {
                return action.apply(player);
            } finally {
                afterUpdate(player);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<PlayerSummary> find(String wallet) {
        ReentrantLock lock = lockFor(wallet);
        lock.lock();
        try {
            Player player = players.get(wallet);
            if (player == null) {
                player = loadExisting(wallet);
                if (player != null) {
                    players.put(wallet, player);
                }
            }
            return Optional.ofNullable(player).map(Player::summary);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        return players.size();
    }

    /**
     * Player previously stored for {@code wallet}, or null when there is none. Called with the
     * wallet's lock held.
     */
    @Nullable
    protected Player loadExisting(String wallet) {
        return null;
    }

    /**
     * Create a player the first time a wallet is referenced. Called with the wallet's lock held.
     */
    protected Player createPlayer(String wallet) {
        log.debug("Creating player {}", wallet);
        return new Player(wallet);
    }

    /**
     * Hook run with the wallet's lock held after each {@link #withPlayer} action.
     */
    protected void afterUpdate(Player player) {
    }

    private Player loadOrCreate(String wallet) {
        Player existing = loadExisting(wallet);
        return existing != null ? existing : createPlayer(wallet);
    }

    private ReentrantLock lockFor(String wallet) {
        try {
            return locks.get(wallet, ReentrantLock::new);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Failed to create lock for " + wallet, e.getCause());
        }
    }
}
