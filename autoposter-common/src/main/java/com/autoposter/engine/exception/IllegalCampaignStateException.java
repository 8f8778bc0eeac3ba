package com.autoposter.engine.exception;

import com.autoposter.engine.model.CampaignStatus;

public class IllegalCampaignStateException extends AutoPosterException {

    public IllegalCampaignStateException(Long campaignId, CampaignStatus status, String action) {
        super("Cannot " + action + " campaign " + campaignId + " in status " + status);
    }
}
