package com.perm.deadline;

/**
 * Activation outcome of a deadline: active, or inactive for exactly one reason.
 *
 * @param active           Whether the deadline still matters
 * @param supersededReason Reason it does not, null iff active
 */
public record DeadlineStatus(boolean active, SupersessionReason supersededReason) {

    private static final DeadlineStatus ACTIVE = new DeadlineStatus(true, null);

    public DeadlineStatus {
        if (active == (supersededReason != null)) {
            throw new IllegalArgumentException("An active deadline has no reason; an inactive one has exactly one");
        }
    }

    public static DeadlineStatus activeStatus() {
        return ACTIVE;
    }

    public static DeadlineStatus superseded(SupersessionReason reason) {
        return new DeadlineStatus(false, reason);
    }
}
