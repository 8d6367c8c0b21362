package com.wasteland.state;

import com.google.common.hash.Hashing;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.wasteland.data.GsonFactory;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Player store that keeps players in memory and mirrors each one to a JSON file.
 *
 * <p>A player is read from disk the first time its wallet is referenced and written back
 * after every locked operation, while the wallet's lock is still held. A record that cannot
 * be read is left untouched and the operation fails.
 *
 * <p>Persistence location: {@code <directory>/<wallet_hash>.json}
 */
@Slf4j
public class JsonFilePlayerStore extends InMemoryPlayerStore {

    @Getter
    private final Path directory;

    private final Gson gson;

    public JsonFilePlayerStore(Path directory) {
        this.directory = directory;
        this.gson = GsonFactory.createPrettyPrinting();
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create player store directory " + directory, e);
        }
        log.info("JsonFilePlayerStore persisting to {}", directory);
    }

    @Override
    protected Player loadExisting(String wallet) {
        Path path = pathFor(wallet);
        if (!Files.exists(path)) {
            return null;
        }
        Player player;
        try {
            player = gson.fromJson(Files.readString(path, StandardCharsets.UTF_8), Player.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read player record " + path, e);
        } catch (JsonParseException e) {
            throw new IllegalStateException("Unreadable player record " + path + ": " + e.getMessage(), e);
        }
        if (player == null || !wallet.equals(player.getWallet())) {
            throw new IllegalStateException("Player record " + path + " does not belong to " + wallet);
        }
        player.relinkGear();
        log.debug("Loaded player {} from {}", wallet, path);
        return player;
    }

    /**
     * Write the player atomically. A failed write propagates so the caller never reports
     * an update that was not persisted.
     */
    @Override
    protected void afterUpdate(Player player) {
        Path path = pathFor(player.getWallet());
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Files.writeString(temp, gson.toJson(player), StandardCharsets.UTF_8);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("Failed to save player {} to {}", player.getWallet(), path, e);
            throw new UncheckedIOException("Failed to save player " + player.getWallet(), e);
        }
    }

    Path pathFor(String wallet) {
        String hash = Hashing.sha256().hashString(wallet, StandardCharsets.UTF_8).toString().substring(0, 16);
        return directory.resolve(hash + ".json");
    }
}
