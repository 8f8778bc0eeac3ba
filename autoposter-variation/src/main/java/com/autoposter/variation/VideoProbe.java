package com.autoposter.variation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Reads stream information with ffprobe. Results are cached per path and modification time
 * since every job of a campaign probes the same source.
 */
@Slf4j
public class VideoProbe {

    private final CommandRunner runner;
    private final VariationSettings settings;
    private final String ffprobe;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Cache<String, VideoInfo> cache = Caffeine.newBuilder()
            .maximumSize(500)
            .expireAfterWrite(30, TimeUnit.MINUTES)
            .build();

    public VideoProbe(CommandRunner runner, VariationSettings settings) {
        this.runner = runner;
        this.settings = settings;
        this.ffprobe = FFmpegCommandBuilder.resolveBinary(settings.getFfprobePath(), "ffprobe");
    }

    public VideoInfo probe(Path input) {
        String key;
        try {
            key = input.toAbsolutePath() + "@" + Files.getLastModifiedTime(input).toMillis();
        } catch (IOException e) {
            throw new VariationException(VariationException.Kind.SOURCE_NOT_FOUND, VariationException.Stage.PROBE,
                    "Cannot read " + input, null, e);
        }

        VideoInfo cached = cache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        VideoInfo info = runProbe(input);
        cache.put(key, info);
        return info;
    }

    private VideoInfo runProbe(Path input) {
        List<String> command = FFmpegCommandBuilder.buildProbeCommand(ffprobe, input);
        CommandResult result;
        try {
            result = runner.run(command, settings.getProbeTimeout());
        } catch (IOException e) {
            throw new VariationException(VariationException.Kind.ENCODER_UNAVAILABLE, VariationException.Stage.PROBE,
                    "ffprobe could not be started", e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VariationException(VariationException.Kind.CANCELLED, VariationException.Stage.PROBE,
                    "Interrupted while probing " + input);
        }

        if (result.isTimedOut()) {
            throw new VariationException(VariationException.Kind.TIMEOUT, VariationException.Stage.PROBE,
                    "ffprobe timed out for " + input);
        }
        if (result.getExitCode() != 0) {
            throw new VariationException(VariationException.Kind.ENCODE_FAILED, VariationException.Stage.PROBE,
                    "ffprobe exited with code " + result.getExitCode(), DiagnosticParser.parse(result.getOutput()));
        }
        return parse(result.getOutput(), input);
    }

    VideoInfo parse(String json, Path input) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new VariationException(VariationException.Kind.ENCODE_FAILED, VariationException.Stage.PROBE,
                    "Unreadable ffprobe output for " + input, e.getMessage(), e);
        }

        JsonNode video = null;
        for (JsonNode stream : root.path("streams")) {
            if ("video".equals(stream.path("codec_type").asText())) {
                video = stream;
                break;
            }
        }
        if (video == null) {
            throw new VariationException(VariationException.Kind.ENCODE_FAILED, VariationException.Stage.PROBE,
                    "No video stream found in " + input);
        }

        JsonNode format = root.path("format");
        VideoInfo info = new VideoInfo(
                video.path("width").asInt(0),
                video.path("height").asInt(0),
                parseFrameRate(video.path("r_frame_rate").asText("0/1")),
                format.path("bit_rate").asLong(0),
                format.path("duration").asDouble(0),
                video.path("codec_name").asText("unknown"));
        log.debug("Probed {}: {}", input, info);
        return info;
    }

    static double parseFrameRate(String rate) {
        String[] parts = rate.split("/");
        try {
            if (parts.length == 2) {
                double denominator = Double.parseDouble(parts[1]);
                return denominator == 0 ? 0 : Double.parseDouble(parts[0]) / denominator;
            }
            return Double.parseDouble(rate);
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
