package com.phillippitts.attendancekiosk.service.tracking;

import com.phillippitts.attendancekiosk.domain.AttendanceWindow;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last recorded decision per person, used to suppress repeated punches within one window.
 *
 * <p>Written only from the decisioning path (state machine and decision recorder on the frame
 * thread). Reads from other threads see a consistent entry per person.
 */
public class PersonCooldownRegistry {

    /**
     * Last recorded decision of one person.
     */
    public record PersonCooldown(Instant lastDecisionAt, String lastDecisionWindow) {
    }

    private final Duration cooldown;
    private final Map<String, PersonCooldown> byPerson = new ConcurrentHashMap<>();

    public PersonCooldownRegistry(Duration cooldown) {
        this.cooldown = Objects.requireNonNull(cooldown, "cooldown");
    }

    /**
     * Returns true when the person already has a decision in {@code window} younger than the cooldown.
     */
    public boolean isActive(String personId, AttendanceWindow window, Instant now) {
        PersonCooldown entry = byPerson.get(personId);
        if (entry == null || !entry.lastDecisionWindow().equals(window.key())) {
            return false;
        }
        return Duration.between(entry.lastDecisionAt(), now).compareTo(cooldown) < 0;
    }

    public void record(String personId, AttendanceWindow window, Instant at) {
        byPerson.put(personId, new PersonCooldown(at, window.key()));
    }

    /**
     * Drops the cooldown if it still belongs to {@code windowKey}; used when the decision was not persisted.
     */
    public void release(String personId, String windowKey) {
        byPerson.computeIfPresent(personId,
                (id, entry) -> entry.lastDecisionWindow().equals(windowKey) ? null : entry);
    }

    public Optional<PersonCooldown> get(String personId) {
        return Optional.ofNullable(byPerson.get(personId));
    }

    public int size() {
        return byPerson.size();
    }
}
