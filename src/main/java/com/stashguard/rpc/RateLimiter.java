package com.stashguard.rpc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-player submission cooldown.
 *
 * <p>Remembers the time of each player's last accepted attempt for the lifetime of the
 * instance. An attempt inside the cooldown is rejected and leaves the stored time alone, so
 * retrying does not extend the wait. An accepted attempt is recorded immediately, before the
 * caller does any further work.
 */
public class RateLimiter {

    private static final Logger LOGGER = LoggerFactory.getLogger(RateLimiter.class);

    public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(5);

    private final Map<String, Long> lastAccepted = new ConcurrentHashMap<>();
    private final Clock clock;
    private final long cooldownMillis;

    public RateLimiter(Clock clock) {
        this(clock, DEFAULT_COOLDOWN);
    }

    public RateLimiter(Clock clock, Duration cooldown) {
        this.clock = clock;
        this.cooldownMillis = cooldown.toMillis();
    }

    /**
     * Checks the cooldown at the current clock time and records the attempt if allowed.
     *
     * @param playerId the submitting player
     * @return true if the attempt may proceed
     */
    public boolean tryAcquire(String playerId) {
        return checkAndRecord(playerId, clock.millis());
    }

    /**
     * Checks the cooldown at {@code nowMillis} and records the attempt if allowed.
     * The check and the update are atomic per player.
     *
     * @param playerId the submitting player
     * @param nowMillis attempt time in epoch milliseconds
     * @return true if the attempt may proceed
     */
    public boolean checkAndRecord(String playerId, long nowMillis) {
        boolean[] allowed = new boolean[1];
        lastAccepted.compute(playerId, (id, last) -> {
            if (last != null && nowMillis - last < cooldownMillis) {
                allowed[0] = false;
                return last;
            }
            allowed[0] = true;
            return nowMillis;
        });

        if (!allowed[0]) {
            LOGGER.warn("Rate limiting player {} - last accepted submission {} ms ago",
                        playerId, nowMillis - lastAccepted.get(playerId));
        }
        return allowed[0];
    }

    /**
     * @return the time of the player's last accepted attempt, if any
     */
    public OptionalLong lastAccepted(String playerId) {
        Long last = lastAccepted.get(playerId);
        return last == null ? OptionalLong.empty() : OptionalLong.of(last);
    }

    /**
     * Gets current limiter state for diagnostics.
     */
    public Map<String, Object> getMetrics() {
        return Map.of(
            "trackedPlayers", lastAccepted.size(),
            "cooldownMillis", cooldownMillis
        );
    }
}
