package com.autoposter.variation;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external command to completion or until the timeout elapses.
 */
public interface CommandRunner {

    /**
     * @throws IOException when the executable cannot be started
     */
    CommandResult run(List<String> command, Duration timeout) throws IOException, InterruptedException;
}
