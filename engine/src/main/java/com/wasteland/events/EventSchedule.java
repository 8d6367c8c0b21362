package com.wasteland.events;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.wasteland.data.GsonFactory;
import com.wasteland.data.JsonResourceLoader;
import com.wasteland.data.model.WorldEvent;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Rotating world events, alternating with the parity of the UTC hour.
 *
 * <p>Events are loaded from {@code data/events.json}. Exactly one event must be defined
 * for each hour parity.
 */
@Slf4j
@Singleton
public class EventSchedule {

    public static final String DATA_FILE = "/data/events.json";

    /**
     * How long clients should wait before polling the schedule again.
     */
    public static final Duration CHECK_INTERVAL = Duration.ofMinutes(10);

    private final List<WorldEvent> events;
    private final Clock clock;

    @Inject
    public EventSchedule(Clock clock) {
        this(DATA_FILE, clock);
    }

    public EventSchedule(String resourcePath, Clock clock) {
        this.clock = clock;
        Gson gson = GsonFactory.create();
        this.events = JsonResourceLoader.loadAndParse(gson, resourcePath, EventSchedule::parseEvents);
        for (int parity = 0; parity < 2; parity++) {
            if (forParity(parity).isEmpty()) {
                throw new JsonResourceLoader.JsonLoadException(
                        "No event defined for hour parity " + parity + " in " + resourcePath);
            }
        }
        log.info("Loaded {} world events from {}", events.size(), resourcePath);
    }

    /**
     * The event active at the current time.
     */
    public ActiveEvent current() {
        return current(clock.instant());
    }

    /**
     * The event active at {@code now}.
     */
    public ActiveEvent current(Instant now) {
        int hour = now.atZone(ZoneOffset.UTC).getHour();
        WorldEvent event = forParity(hour % 2).orElseThrow();
        return new ActiveEvent(event, now.plus(CHECK_INTERVAL));
    }

    /**
     * Find an event by its display name.
     */
    public Optional<WorldEvent> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return events.stream().filter(e -> e.name().equals(name)).findFirst();
    }

    public List<WorldEvent> getAll() {
        return Collections.unmodifiableList(events);
    }

    private Optional<WorldEvent> forParity(int parity) {
        return events.stream().filter(e -> e.hourParity() == parity).findFirst();
    }

    private static List<WorldEvent> parseEvents(JsonObject root) {
        List<WorldEvent> result = new ArrayList<>();
        for (JsonElement element : JsonResourceLoader.getRequiredArray(root, "events")) {
            JsonObject obj = element.getAsJsonObject();
            int parity = obj.get("hourParity").getAsInt();
            if (parity != 0 && parity != 1) {
                throw new JsonResourceLoader.JsonLoadException("hourParity must be 0 or 1, got " + parity);
            }
            result.add(WorldEvent.builder()
                    .name(JsonResourceLoader.getRequiredString(obj, "name"))
                    .locationId(JsonResourceLoader.getRequiredString(obj, "locationId"))
                    .bonusCaps(obj.has("bonusCaps") ? obj.get("bonusCaps").getAsInt() : 0)
                    .healthRisk(obj.has("healthRisk") ? obj.get("healthRisk").getAsInt() : 0)
                    .hourParity(parity)
                    .build());
        }
        return result;
    }
}
