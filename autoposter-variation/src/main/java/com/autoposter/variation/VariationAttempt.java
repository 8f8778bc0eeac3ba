package com.autoposter.variation;

import lombok.Value;

/**
 * Outcome of one item of a batch: either a result or the tagged error that stopped it.
 */
@Value
public class VariationAttempt {
    int index;
    long seed;
    VariationResult result;
    VariationException.Kind errorKind;
    VariationException.Stage errorStage;
    String errorMessage;

    public static VariationAttempt succeeded(int index, VariationResult result) {
        return new VariationAttempt(index, result.getSeed(), result, null, null, null);
    }

    public static VariationAttempt failed(int index, long seed, VariationException error) {
        return new VariationAttempt(index, seed, null, error.getKind(), error.getStage(), error.getMessage());
    }

    public boolean isSuccess() {
        return result != null;
    }
}
