package com.questrail.governance.execution;

import com.questrail.governance.api.Proposal;

/**
 * ProposalHandler
 * =============================================================================
 * Side effect performed when a passed proposal of a given type is executed.
 *
 * <p>
 * Handlers run under the ledger's write lock, after every voting and timing
 * check has passed and before the proposal is marked executed. They must
 * complete in bounded local time. A handler that throws leaves the proposal
 * unexecuted, so execution can be attempted again; the ledger reports the
 * failure as a {@link ProposalExecutionException}.
 * </p>
 */
@FunctionalInterface
public interface ProposalHandler
{
    /**
     * @param proposal the proposal being executed, with its final tally
     * @return the success flag reported in the {@code ProposalExecuted} event
     */
    boolean execute(Proposal proposal);
}
