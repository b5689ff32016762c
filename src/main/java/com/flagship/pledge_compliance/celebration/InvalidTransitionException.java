package com.flagship.pledge_compliance.celebration;

import lombok.Getter;

/**
 * Thrown when a requested status change is not in the transition table.
 * A rejected transition writes nothing.
 */
@Getter
public class InvalidTransitionException extends IllegalStateException {

    private final CelebrationStatus from;
    private final CelebrationStatus to;

    public InvalidTransitionException(CelebrationStatus from, CelebrationStatus to, String message) {
        super(message);
        this.from = from;
        this.to = to;
    }
}
