package com.autoposter.engine.model;

/**
 * Work categories with independent tasks-per-minute budgets.
 */
public enum TaskCategory {
    UPLOAD,
    ACCOUNT_TEST,
    PROXY_CHECK,
    BATCH_VIDEO
}
