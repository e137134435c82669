package io.paramfetch.policy;

import java.time.Instant;

/** The slice was retrieved {@code ageMinutes} ago, inside the refetch cooldown. Informational only. */
public record CooldownNote(Instant lastRetrievedAt, long ageMinutes, long cooldownMinutes) {
    public String describe() {
        return "Cooldown: recent fetch " + ageMinutes + "min ago (cooldown " + cooldownMinutes + "min)";
    }
}
