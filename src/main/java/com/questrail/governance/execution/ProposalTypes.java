package com.questrail.governance.execution;

/**
 * Proposal type strings recognized by {@link ProposalHandlerRegistry#defaults()}.
 */
public final class ProposalTypes {
    public static final String SYSTEM_UPGRADE = "SYSTEM_UPGRADE";
    public static final String TRUST_UPDATE = "TRUST_UPDATE";
    public static final String EMERGENCY_OVERRIDE = "EMERGENCY_OVERRIDE";

    private ProposalTypes() {}
}
