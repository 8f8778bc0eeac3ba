package com.autoposter.variation;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class VariationSettings {

    @Builder.Default
    String ffmpegPath = "ffmpeg";
    @Builder.Default
    String ffprobePath = "ffprobe";
    @Builder.Default
    String videoCodec = "libx264";
    @Builder.Default
    String audioCodec = "aac";
    @Builder.Default
    String preset = "medium";
    @Builder.Default
    int crf = 23;
    @Builder.Default
    String audioBitrate = "128k";
    @Builder.Default
    String outputFormat = "mp4";
    /** Used when the source does not report a bitrate, bits per second */
    @Builder.Default
    long fallbackBitrate = 2_500_000L;
    @Builder.Default
    int maxConcurrentTranscodes = 2;
    @Builder.Default
    Duration encodeTimeout = Duration.ofMinutes(10);
    @Builder.Default
    Duration probeTimeout = Duration.ofSeconds(30);

    public static VariationSettings defaults() {
        return VariationSettings.builder().build();
    }
}
