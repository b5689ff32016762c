package com.flagship.pledge_compliance.celebration;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Transition table for celebration statuses.
 *
 * <pre>
 * active   -> paused, resolved, defunct
 * paused   -> active, defunct
 * resolved -> (terminal)
 * defunct  -> (terminal)
 * </pre>
 *
 * Anything else is rejected, including a transition to the current status.
 * Nothing is ever coerced to a nearby allowed transition.
 */
public final class CelebrationStatusMachine {

    private static final Map<CelebrationStatus, Set<CelebrationStatus>> TRANSITIONS;

    static {
        Map<CelebrationStatus, Set<CelebrationStatus>> table = new EnumMap<>(CelebrationStatus.class);
        table.put(CelebrationStatus.ACTIVE, Collections.unmodifiableSet(EnumSet.of(
                CelebrationStatus.PAUSED, CelebrationStatus.RESOLVED, CelebrationStatus.DEFUNCT)));
        table.put(CelebrationStatus.PAUSED, Collections.unmodifiableSet(EnumSet.of(
                CelebrationStatus.ACTIVE, CelebrationStatus.DEFUNCT)));
        table.put(CelebrationStatus.RESOLVED, Collections.unmodifiableSet(EnumSet.noneOf(CelebrationStatus.class)));
        table.put(CelebrationStatus.DEFUNCT, Collections.unmodifiableSet(EnumSet.noneOf(CelebrationStatus.class)));
        TRANSITIONS = Collections.unmodifiableMap(table);
    }

    private CelebrationStatusMachine() {
        // Utility class
    }

    public static boolean canTransition(CelebrationStatus from, CelebrationStatus to) {
        return from != null && to != null && TRANSITIONS.get(from).contains(to);
    }

    public static Set<CelebrationStatus> allowedTargets(CelebrationStatus from) {
        return TRANSITIONS.get(from);
    }

    /**
     * Validates a transition.
     *
     * @throws InvalidTransitionException naming the disallowed pair
     */
    public static void validate(CelebrationStatus from, CelebrationStatus to) {
        if (to == null) {
            throw new IllegalArgumentException("Target status is required");
        }
        if (!canTransition(from, to)) {
            Set<CelebrationStatus> allowed = allowedTargets(from);
            String valid = allowed.isEmpty()
                    ? "none"
                    : allowed.stream().map(CelebrationStatus::getValue).collect(Collectors.joining(", "));
            throw new InvalidTransitionException(from, to, String.format(
                    "Cannot transition from '%s' to '%s'. Valid transitions: %s",
                    from.getValue(), to.getValue(), valid));
        }
    }
}
