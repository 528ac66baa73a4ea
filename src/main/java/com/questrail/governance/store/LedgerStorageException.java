package com.questrail.governance.store;

/**
 * Indicates that the backing ledger store could not serve a read or persist
 * a write.
 *
 * <p>This is an infrastructure failure and is deliberately outside the
 * {@code GovernanceException} hierarchy: it says nothing about whether the
 * requested operation was legal.</p>
 */
public final class LedgerStorageException extends RuntimeException
{
    public LedgerStorageException(String message) {
        super(message);
    }

    public LedgerStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
