package com.autoposter.engine.model;

public enum ProxyStatus {
    ACTIVE,
    INACTIVE,
    BANNED,
    ERROR
}
