package com.autoposter.engine.service;

/**
 * What to do when a variation's content hash was already produced for the same campaign.
 */
public enum UniquenessPolicy {
    /** Log the collision and post anyway. */
    ADVISORY,
    /** Fail the job with DUPLICATE_CONTENT. */
    ENFORCED
}
