package com.autoposter.variation;

import lombok.Builder;
import lombok.Value;

import java.util.Random;

/**
 * Parameter vector of one variation. Derived deterministically from a seed, so the same
 * seed always yields the same vector.
 */
@Value
@Builder
public class VariationParameters {

    long seed;

    /** eq brightness, [-0.03, 0.03] */
    double brightness;
    /** eq saturation, [0.97, 1.03] */
    double saturation;
    /** eq contrast, [0.98, 1.02] */
    double contrast;

    /** Pixels removed per edge before scaling back, [1, 3] each */
    int cropTop;
    int cropBottom;
    int cropLeft;
    int cropRight;

    /** Multiplier on the source bitrate, [0.97, 1.03] */
    double bitrateFactor;
    /** Temporal noise strength, [1, 3] */
    int noiseStrength;
    /** Playback speed, [0.99, 1.01], audio tempo follows with pitch kept */
    double speed;
    /** Frames skipped at the start, [0, 3] */
    int frameOffset;

    public static VariationParameters fromSeed(long seed) {
        Random random = new Random(seed);
        return VariationParameters.builder()
                .seed(seed)
                .brightness(uniform(random, -0.03, 0.03))
                .saturation(uniform(random, 0.97, 1.03))
                .contrast(uniform(random, 0.98, 1.02))
                .cropTop(between(random, 1, 3))
                .cropBottom(between(random, 1, 3))
                .cropLeft(between(random, 1, 3))
                .cropRight(between(random, 1, 3))
                .bitrateFactor(uniform(random, 0.97, 1.03))
                .noiseStrength(between(random, 1, 3))
                .speed(uniform(random, 0.99, 1.01))
                .frameOffset(between(random, 0, 3))
                .build();
    }

    private static double uniform(Random random, double min, double max) {
        return min + (max - min) * random.nextDouble();
    }

    private static int between(Random random, int min, int maxInclusive) {
        return min + random.nextInt(maxInclusive - min + 1);
    }
}
