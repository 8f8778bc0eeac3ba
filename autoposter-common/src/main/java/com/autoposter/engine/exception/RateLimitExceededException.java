package com.autoposter.engine.exception;

import com.autoposter.engine.model.TaskCategory;
import lombok.Getter;

@Getter
public class RateLimitExceededException extends AutoPosterException {

    private final TaskCategory category;

    public RateLimitExceededException(TaskCategory category) {
        super("Rate limit reached for " + category + " tasks, try again later");
        this.category = category;
    }
}
