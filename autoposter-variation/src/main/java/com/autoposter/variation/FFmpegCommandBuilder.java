package com.autoposter.variation;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class FFmpegCommandBuilder {

    private FFmpegCommandBuilder() {
    }

    /**
     * Resolves the executable: an explicit path wins, then a bundled copy under
     * {@code /opt/bin} or {@code bin/}, then whatever is on the PATH.
     */
    public static String resolveBinary(String configured, String name) {
        if (configured != null && !configured.isBlank() && !configured.equals(name)) {
            return configured;
        }
        File bundled = new File("/opt/bin/" + name);
        if (bundled.exists()) {
            return bundled.getAbsolutePath();
        }
        File local = new File("bin/" + name);
        if (local.exists()) {
            return local.getAbsolutePath();
        }
        return name;
    }

    public static List<String> buildVersionCommand(String ffmpeg) {
        return List.of(ffmpeg, "-hide_banner", "-version");
    }

    public static List<String> buildProbeCommand(String ffprobe, Path input) {
        return List.of(ffprobe,
                "-v", "quiet",
                "-print_format", "json",
                "-show_format",
                "-show_streams",
                input.toString());
    }

    /**
     * Filter chain in pipeline order: color, crop and rescale, noise, speed.
     */
    public static String buildVideoFilter(VariationParameters params, VideoInfo info) {
        List<String> filters = new ArrayList<>();

        filters.add(String.format(Locale.ROOT, "eq=brightness=%.4f:saturation=%.4f:contrast=%.4f",
                params.getBrightness(), params.getSaturation(), params.getContrast()));

        int cropX = params.getCropLeft() + params.getCropRight();
        int cropY = params.getCropTop() + params.getCropBottom();
        if (info.hasDimensions()) {
            filters.add(String.format(Locale.ROOT, "crop=%d:%d:%d:%d",
                    info.getWidth() - cropX, info.getHeight() - cropY, params.getCropLeft(), params.getCropTop()));
            filters.add(String.format(Locale.ROOT, "scale=%d:%d", info.getWidth(), info.getHeight()));
        } else {
            filters.add(String.format(Locale.ROOT, "crop=iw-%d:ih-%d:%d:%d",
                    cropX, cropY, params.getCropLeft(), params.getCropTop()));
            filters.add(String.format(Locale.ROOT, "scale=iw+%d:ih+%d", cropX, cropY));
        }

        filters.add(String.format(Locale.ROOT, "noise=alls=%d:allf=t", params.getNoiseStrength()));
        filters.add(String.format(Locale.ROOT, "setpts=PTS/%.4f", params.getSpeed()));

        return String.join(",", filters);
    }

    public static long targetBitrate(VariationParameters params, VideoInfo info, long fallbackBitrate) {
        long base = info.getBitrate() > 0 ? info.getBitrate() : fallbackBitrate;
        return Math.round(base * params.getBitrateFactor());
    }

    public static List<String> buildVariationCommand(String ffmpeg, Path input, Path output,
                                                     VariationParameters params, VideoInfo info,
                                                     VariationSettings settings) {
        double offsetSeconds = info.getFps() > 0 ? params.getFrameOffset() / info.getFps() : 0.0;
        long bitrate = targetBitrate(params, info, settings.getFallbackBitrate());

        List<String> command = new ArrayList<>();
        command.add(ffmpeg);
        command.add("-hide_banner");
        command.add("-y");
        command.add("-i");
        command.add(input.toString());
        command.add("-ss");
        command.add(String.format(Locale.ROOT, "%.4f", offsetSeconds));

        command.add("-vf");
        command.add(buildVideoFilter(params, info));
        // atempo keeps the pitch while matching the video speed
        command.add("-af");
        command.add(String.format(Locale.ROOT, "atempo=%.4f", params.getSpeed()));

        command.add("-c:v");
        command.add(settings.getVideoCodec());
        command.add("-preset");
        command.add(settings.getPreset());
        command.add("-crf");
        command.add(String.valueOf(settings.getCrf()));
        command.add("-b:v");
        command.add(String.valueOf(bitrate));
        command.add("-maxrate");
        command.add(String.valueOf(bitrate));
        command.add("-bufsize");
        command.add(String.valueOf(bitrate * 2));
        command.add("-pix_fmt");
        command.add("yuv420p");

        command.add("-c:a");
        command.add(settings.getAudioCodec());
        command.add("-b:a");
        command.add(settings.getAudioBitrate());

        command.add("-map_metadata");
        command.add("-1");
        command.add("-map_chapters");
        command.add("-1");
        command.add("-fflags");
        command.add("+bitexact");
        command.add("-movflags");
        command.add("+faststart");

        command.add(output.toString());
        return command;
    }
}
