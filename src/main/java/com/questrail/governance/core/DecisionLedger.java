package com.questrail.governance.core;

import com.questrail.governance.api.Agent;
import com.questrail.governance.api.ConsensusDecision;
import com.questrail.governance.api.DecisionVerification;
import com.questrail.governance.api.GovernanceException;
import com.questrail.governance.store.LedgerStore;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.questrail.governance.api.GovernanceErrorKind.ALREADY_RECORDED;
import static com.questrail.governance.api.GovernanceErrorKind.INVALID_ARGUMENT;

/**
 * DecisionLedger
 * -----------------------------------------------------------------------------
 * Write-once table of consensus decisions keyed by request id.
 *
 * <p>Recording is idempotent-reject: the first submission for an id wins and
 * every later one fails with {@code ALREADY_RECORDED}, whatever its payload.
 * Verification never fails. Callers must hold the ledger lock.</p>
 */
final class DecisionLedger
{
    private final LedgerStore store;

    DecisionLedger(LedgerStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    ConsensusDecision record(Agent submitter,
                             String requestId,
                             String decisionType,
                             String finalDecision,
                             double confidence,
                             List<String> participatingAgents,
                             String proofHash,
                             Instant now) {
        Objects.requireNonNull(submitter, "submitter");
        Objects.requireNonNull(decisionType, "decisionType");
        Objects.requireNonNull(finalDecision, "finalDecision");
        Objects.requireNonNull(participatingAgents, "participatingAgents");
        Objects.requireNonNull(proofHash, "proofHash");

        if (requestId == null || requestId.isEmpty()) {
            throw GovernanceException.of(INVALID_ARGUMENT, "request id must not be empty");
        }

        Optional<ConsensusDecision> existing = store.findDecision(requestId);
        if (existing.isPresent() && existing.get().validated()) {
            throw GovernanceException.of(ALREADY_RECORDED,
                    "decision %s has already been recorded", requestId);
        }

        ConsensusDecision decision = new ConsensusDecision(
                requestId,
                decisionType,
                finalDecision,
                confidence,
                participatingAgents,
                now,
                proofHash,
                true,
                submitter.id());
        store.saveDecision(decision);
        return decision;
    }

    DecisionVerification verify(String requestId) {
        if (requestId == null || requestId.isEmpty()) {
            return DecisionVerification.unknown();
        }
        return store.findDecision(requestId)
                .map(DecisionVerification::of)
                .orElseGet(DecisionVerification::unknown);
    }

    Optional<ConsensusDecision> find(String requestId) {
        if (requestId == null || requestId.isEmpty()) {
            return Optional.empty();
        }
        return store.findDecision(requestId);
    }

    long count() {
        return store.decisionCount();
    }
}
