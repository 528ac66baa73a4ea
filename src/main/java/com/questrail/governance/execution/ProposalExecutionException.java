package com.questrail.governance.execution;

/**
 * Raised when a {@link ProposalHandler} fails while executing a passed
 * proposal.
 *
 * <p>The handler's own exception is the cause. The proposal is left
 * unexecuted, so execution may be attempted again.</p>
 */
public final class ProposalExecutionException extends RuntimeException
{
    private final long proposalId;
    private final String proposalType;

    public ProposalExecutionException(long proposalId, String proposalType, Throwable cause) {
        super(String.format("%s handler failed for proposal %d: %s",
                proposalType, proposalId, cause.getMessage()), cause);
        this.proposalId = proposalId;
        this.proposalType = proposalType;
    }

    public long proposalId() {
        return proposalId;
    }

    public String proposalType() {
        return proposalType;
    }
}
