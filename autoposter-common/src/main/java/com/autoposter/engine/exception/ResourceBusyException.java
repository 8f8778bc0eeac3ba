package com.autoposter.engine.exception;

import lombok.Getter;

@Getter
public class ResourceBusyException extends AutoPosterException {
    private final Long accountId;

    public ResourceBusyException(Long accountId, Long holderJobId) {
        super("Account " + accountId + " is leased by job " + holderJobId);
        this.accountId = accountId;
    }
}
