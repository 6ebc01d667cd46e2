package com.stratum.migration;

/** Thrown when another process holds the migration lease, or took it over from this one. */
public class MigrationLockException extends MigrationException {

    private final String holder;

    public MigrationLockException(String holder, Throwable cause) {
        this("Another migration is in progress (lock held by %s)".formatted(holder), holder, cause);
    }

    private MigrationLockException(String message, String holder, Throwable cause) {
        super(message, cause);
        this.holder = holder;
    }

    /** The lease of {@code owner} expired and is now held by {@code holder}, or by nobody. */
    public static MigrationLockException leaseLost(String owner, String holder) {
        return new MigrationLockException(
                "Migration lock lease of %s was lost (lock held by %s)".formatted(owner, holder),
                holder,
                null);
    }

    public String holder() {
        return holder;
    }
}
