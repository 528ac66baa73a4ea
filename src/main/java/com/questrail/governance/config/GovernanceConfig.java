package com.questrail.governance.config;

import com.questrail.governance.api.AgentId;

import java.time.Duration;
import java.util.Objects;

/**
 * GovernanceConfig
 * -----------------------------------------------------------------------------
 * Process-wide governance constants, fixed when the ledger is constructed.
 *
 * <h2>Configuration parameters</h2>
 * <ul>
 *   <li><b>admin</b>: the only identity allowed to register and deactivate
 *       agents, cancel proposals and pause the ledger.</li>
 *   <li><b>votingPeriod</b>: length of the voting window that opens when a
 *       proposal is created.</li>
 *   <li><b>executionDelay</b>: mandatory wait after the voting window closes
 *       before execution is accepted.</li>
 *   <li><b>quorumThreshold</b>: minimum <em>summed voting power</em>
 *       ({@code yes + no}) required for execution. This is not a count of
 *       distinct voters: one agent with power 3 satisfies a threshold of 3.</li>
 * </ul>
 */
public record GovernanceConfig(
        AgentId admin,
        Duration votingPeriod,
        Duration executionDelay,
        long quorumThreshold
) {
    public static final Duration DEFAULT_VOTING_PERIOD = Duration.ofHours(24);
    public static final Duration DEFAULT_EXECUTION_DELAY = Duration.ofHours(2);
    public static final long DEFAULT_QUORUM_THRESHOLD = 3L;

    public GovernanceConfig {
        Objects.requireNonNull(admin, "admin");
        Objects.requireNonNull(votingPeriod, "votingPeriod");
        Objects.requireNonNull(executionDelay, "executionDelay");

        if (admin.isEmpty()) {
            throw new IllegalArgumentException("admin must not be empty");
        }
        if (votingPeriod.isNegative()) {
            throw new IllegalArgumentException("votingPeriod must be non-negative");
        }
        if (executionDelay.isNegative()) {
            throw new IllegalArgumentException("executionDelay must be non-negative");
        }
        if (quorumThreshold < 0) {
            throw new IllegalArgumentException("quorumThreshold must be non-negative");
        }
    }

    /**
     * 24h voting, 2h execution delay, quorum of 3 voting power.
     */
    public static GovernanceConfig defaults(AgentId admin) {
        return builder().withAdmin(admin).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private AgentId admin;
        private Duration votingPeriod = DEFAULT_VOTING_PERIOD;
        private Duration executionDelay = DEFAULT_EXECUTION_DELAY;
        private long quorumThreshold = DEFAULT_QUORUM_THRESHOLD;

        public Builder withAdmin(AgentId admin) {
            this.admin = admin;
            return this;
        }

        public Builder withVotingPeriod(Duration votingPeriod) {
            this.votingPeriod = votingPeriod;
            return this;
        }

        public Builder withExecutionDelay(Duration executionDelay) {
            this.executionDelay = executionDelay;
            return this;
        }

        public Builder withQuorumThreshold(long quorumThreshold) {
            this.quorumThreshold = quorumThreshold;
            return this;
        }

        public GovernanceConfig build() {
            return new GovernanceConfig(admin, votingPeriod, executionDelay, quorumThreshold);
        }
    }
}
