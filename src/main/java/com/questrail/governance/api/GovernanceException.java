package com.questrail.governance.api;

import java.util.Objects;

/**
 * Thrown when the ledger rejects an operation.
 *
 * <p>A rejected operation never changes ledger state. Callers branch on
 * {@link #kind()} rather than on the message.</p>
 */
public final class GovernanceException extends RuntimeException
{
    private final GovernanceErrorKind kind;

    public GovernanceException(GovernanceErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public GovernanceErrorKind kind() {
        return kind;
    }

    public static GovernanceException of(GovernanceErrorKind kind, String format, Object... args) {
        return new GovernanceException(kind, String.format(format, args));
    }
}
