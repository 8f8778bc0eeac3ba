package com.autoposter.engine.model;

public enum SelectionStrategy {
    ALL,
    RANDOM,
    SPECIFIC
}
