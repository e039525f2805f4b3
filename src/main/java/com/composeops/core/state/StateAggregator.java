package com.composeops.core.state;

import com.composeops.core.model.EntityState;
import com.composeops.core.model.ServiceState;

import java.util.List;
import java.util.Locale;

/**
 * Derives one {@link EntityState} for a compose project from the states of its services.
 * <p>
 * Rules, first match wins:
 * <ol>
 *   <li>no services: {@code DOWN}</li>
 *   <li>every service running: {@code RUNNING}</li>
 *   <li>some but not all running: {@code DEGRADED}</li>
 *   <li>any restarting: {@code RESTARTING}</li>
 *   <li>any exited: {@code EXITED}</li>
 *   <li>any created: {@code CREATED}</li>
 *   <li>otherwise {@code STOPPED}</li>
 * </ol>
 * Raw states are compared case-insensitively after trimming.
 */
public final class StateAggregator {

    private static final String UNKNOWN_LITERAL = "Unknown";

    private StateAggregator() {} // utility class

    public static EntityState aggregate(List<ServiceState> services) {
        if (services == null || services.isEmpty()) {
            return EntityState.DOWN;
        }

        int running = 0;
        boolean restarting = false;
        boolean exited = false;
        boolean created = false;

        for (ServiceState service : services) {
            EntityState state = fromStateString(service != null ? service.rawState() : null);
            switch (state) {
                case RUNNING -> running++;
                case RESTARTING -> restarting = true;
                case EXITED -> exited = true;
                case CREATED -> created = true;
                default -> {
                    // paused, dead, removing and unparseable states only count toward the total
                }
            }
        }

        if (running == services.size()) {
            return EntityState.RUNNING;
        }
        if (running > 0) {
            return EntityState.DEGRADED;
        }
        if (restarting) {
            return EntityState.RESTARTING;
        }
        if (exited) {
            return EntityState.EXITED;
        }
        if (created) {
            return EntityState.CREATED;
        }
        return EntityState.STOPPED;
    }

    /**
     * Canonical lowercase form of a state, e.g. {@code "degraded"}.
     * {@link EntityState#UNKNOWN} has no service-reported form and maps to {@code "Unknown"}.
     */
    public static String toStateString(EntityState state) {
        if (state == null || state == EntityState.UNKNOWN) {
            return UNKNOWN_LITERAL;
        }
        return state.name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a state string case-insensitively. Anything unrecognised, including
     * {@code "unknown"} itself, yields {@link EntityState#UNKNOWN}.
     */
    public static EntityState fromStateString(String raw) {
        if (raw == null) {
            return EntityState.UNKNOWN;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "down" -> EntityState.DOWN;
            case "running" -> EntityState.RUNNING;
            case "degraded" -> EntityState.DEGRADED;
            case "restarting" -> EntityState.RESTARTING;
            case "exited" -> EntityState.EXITED;
            case "stopped" -> EntityState.STOPPED;
            case "created" -> EntityState.CREATED;
            default -> EntityState.UNKNOWN;
        };
    }
}
