package com.autoposter.variation;

import lombok.Value;

@Value
public class CommandResult {
    int exitCode;
    String output;
    boolean timedOut;

    public boolean isSuccess() {
        return !timedOut && exitCode == 0;
    }

    public static CommandResult timeout(String output) {
        return new CommandResult(-1, output, true);
    }
}
