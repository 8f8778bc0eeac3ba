package com.autoposter.engine.model;

public enum AccountStatus {
    ACTIVE,
    BANNED,
    COOLDOWN,
    NEEDS_CAPTCHA,
    INACTIVE
}
