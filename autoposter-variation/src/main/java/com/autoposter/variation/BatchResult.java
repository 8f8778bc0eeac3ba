package com.autoposter.variation;

import lombok.Value;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

@Value
public class BatchResult {
    int requested;
    List<VariationAttempt> attempts;

    public long getSucceeded() {
        return attempts.stream().filter(VariationAttempt::isSuccess).count();
    }

    public long getFailed() {
        return attempts.size() - getSucceeded();
    }

    public List<Path> outputs() {
        return attempts.stream()
                .filter(VariationAttempt::isSuccess)
                .map(attempt -> attempt.getResult().getOutputPath())
                .collect(Collectors.toList());
    }

    public List<VariationAttempt> failures() {
        return attempts.stream()
                .filter(attempt -> !attempt.isSuccess())
                .collect(Collectors.toList());
    }
}
