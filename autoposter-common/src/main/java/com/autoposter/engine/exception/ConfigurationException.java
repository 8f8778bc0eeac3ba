package com.autoposter.engine.exception;

/**
 * Invalid campaign or job input. Never retried; a planner run that raises it creates no jobs.
 */
public class ConfigurationException extends AutoPosterException {
    public ConfigurationException(String message) {
        super(message);
    }
}
