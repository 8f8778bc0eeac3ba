package com.autoposter.engine.model;

public enum ProxyType {
    RESIDENTIAL,
    DATACENTER,
    MOBILE
}
