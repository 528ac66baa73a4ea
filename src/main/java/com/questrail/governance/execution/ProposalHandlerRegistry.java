package com.questrail.governance.execution;

import com.questrail.governance.api.Proposal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * ProposalHandlerRegistry
 * -----------------------------------------------------------------------------
 * Immutable mapping from proposal type to {@link ProposalHandler}.
 *
 * <p>This is the only place proposal types acquire meaning. The voting engine
 * never branches on the type string; it asks the registry to dispatch.
 * Unrecognized types dispatch to nothing and report {@code false}.</p>
 *
 * <p>{@link #defaults()} registers an acknowledge-only handler for each of
 * {@link ProposalTypes#SYSTEM_UPGRADE}, {@link ProposalTypes#TRUST_UPDATE} and
 * {@link ProposalTypes#EMERGENCY_OVERRIDE}. Real side effects are added by
 * registering a replacement handler for the type.</p>
 */
public final class ProposalHandlerRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProposalHandlerRegistry.class);

    private final Map<String, ProposalHandler> handlers;

    private ProposalHandlerRegistry(Map<String, ProposalHandler> handlers) {
        this.handlers = Collections.unmodifiableMap(new HashMap<>(handlers));
    }

    /**
     * Runs the handler registered for the proposal's type.
     *
     * @return the handler's result, or {@code false} if no handler is registered
     * @throws ProposalExecutionException if the handler throws
     */
    public boolean dispatch(Proposal proposal) {
        Objects.requireNonNull(proposal, "proposal");
        ProposalHandler handler = handlers.get(proposal.proposalType());
        if (handler == null) {
            log.warn("No handler registered for proposal type '{}' (proposal {})",
                proposal.proposalType(), proposal.id());
            return false;
        }
        try {
            return handler.execute(proposal);
        } catch (RuntimeException e) {
            throw new ProposalExecutionException(proposal.id(), proposal.proposalType(), e);
        }
    }

    public Optional<ProposalHandler> handlerFor(String proposalType) {
        return Optional.ofNullable(handlers.get(proposalType));
    }

    public Set<String> registeredTypes() {
        return handlers.keySet();
    }

    public static ProposalHandlerRegistry defaults() {
        return builder().withDefaults().build();
    }

    public static ProposalHandlerRegistry empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Handler that only records that the proposal went through.
     */
    static ProposalHandler acknowledging(String proposalType) {
        return proposal -> {
            log.info("{} proposal {} acknowledged (content={}, yes={}, no={})",
                proposalType, proposal.id(), proposal.contentHash(),
                proposal.yesVotes(), proposal.noVotes());
            return true;
        };
    }

    public static final class Builder {
        private final Map<String, ProposalHandler> handlers = new HashMap<>();

        public Builder withDefaults() {
            register(ProposalTypes.SYSTEM_UPGRADE, acknowledging(ProposalTypes.SYSTEM_UPGRADE));
            register(ProposalTypes.TRUST_UPDATE, acknowledging(ProposalTypes.TRUST_UPDATE));
            register(ProposalTypes.EMERGENCY_OVERRIDE, acknowledging(ProposalTypes.EMERGENCY_OVERRIDE));
            return this;
        }

        /**
         * Registers or replaces the handler for a proposal type.
         */
        public Builder register(String proposalType, ProposalHandler handler) {
            Objects.requireNonNull(proposalType, "proposalType");
            Objects.requireNonNull(handler, "handler");
            if (proposalType.isBlank()) {
                throw new IllegalArgumentException("proposalType must not be blank");
            }
            handlers.put(proposalType, handler);
            return this;
        }

        public ProposalHandlerRegistry build() {
            return new ProposalHandlerRegistry(handlers);
        }
    }
}
