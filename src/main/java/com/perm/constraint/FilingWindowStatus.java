package com.perm.constraint;

/**
 * Position of a reference date relative to the filing window.
 *
 * @param state         Window state
 * @param window        The window, null when recruitment dates are incomplete
 * @param daysUntilOpen Days until the window opens, only while waiting
 * @param daysRemaining Days left to file, only while open
 * @param message       Human-readable summary
 */
public record FilingWindowStatus(State state, FilingWindow window, Integer daysUntilOpen,
                                 Integer daysRemaining, String message) {

    public enum State {
        WAITING,
        OPEN,
        CLOSED
    }
}
