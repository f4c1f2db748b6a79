package com.regencredit.core.error;

/**
 * Machine-readable reasons attached to every rejected protocol call.
 */
public enum ReasonCode {
    // Configuration
    INVALID_CONFIGURATION,
    PROTOCOL_NOT_RUNNING,

    // Community
    ALREADY_REGISTERED,
    NOT_REGISTERED,
    USER_DENIED,
    POPULATION_CAP_REACHED,
    INVITATION_REQUIRED,
    INVITATION_NOT_ALLOWED,
    INVITATION_ALREADY_EXISTS,
    INVITE_ELIGIBILITY,
    INVITER_PENALIZED,
    INVITATION_COOLDOWN,

    // Inspection
    AREA_OUT_OF_BOUNDS,
    PENDING_INSPECTION,
    INSPECTION_LIMIT_REACHED,
    REQUEST_COOLDOWN,
    INSPECTION_NOT_FOUND,
    INVALID_INSPECTION_STATE,
    INSPECTOR_BUSY,
    INSPECTOR_COOLDOWN,
    ALREADY_INSPECTED_REGENERATOR,
    NOT_ASSIGNED_INSPECTOR,
    INSPECTION_EXPIRED,
    INSPECTION_NOT_EXPIRED,
    RESULT_OUT_OF_BOUNDS,
    SAFEGUARD_WINDOW,

    // Governance
    RESOURCE_NOT_FOUND,
    RESOURCE_FINALIZED,
    RESOURCE_ALREADY_INVALID,
    NOT_ALLOWED_TO_PUBLISH,
    PUBLICATION_COOLDOWN,
    NOT_ALLOWED_TO_VOTE,
    VOTE_COOLDOWN,
    ALREADY_VOTED,
    SELF_VOTE,
    INSUFFICIENT_POINTS,
    DELATION_NOT_FOUND,

    // Pools and ledger
    UNKNOWN_POOL,
    INVALID_AMOUNT,
    TEXT_TOO_LONG,
    INVALID_TEXT,

    // Should be unreachable
    LEVEL_UNDERFLOW,
    COUNTER_UNDERFLOW
}
