package com.autoposter.engine.dto;

import com.autoposter.variation.BatchResult;
import com.autoposter.variation.VariationAttempt;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

public record BatchResponse(int requested, long succeeded, long failed, List<String> outputs, List<Failure> failures) {

    public record Failure(int index, long seed, String kind, String stage, String message) {
        static Failure of(VariationAttempt attempt) {
            return new Failure(attempt.getIndex(), attempt.getSeed(), String.valueOf(attempt.getErrorKind()),
                    String.valueOf(attempt.getErrorStage()), attempt.getErrorMessage());
        }
    }

    public static BatchResponse from(BatchResult result) {
        return new BatchResponse(result.getRequested(), result.getSucceeded(), result.getFailed(),
                result.outputs().stream().map(Path::toString).collect(Collectors.toList()),
                result.failures().stream().map(Failure::of).collect(Collectors.toList()));
    }
}
