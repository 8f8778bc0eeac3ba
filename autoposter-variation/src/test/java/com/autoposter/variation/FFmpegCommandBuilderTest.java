package com.autoposter.variation;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class FFmpegCommandBuilderTest {

    private final VideoInfo info = new VideoInfo(1080, 1920, 30.0, 2_400_000L, 12.5, "h264");

    private final VariationParameters params = VariationParameters.builder()
            .seed(1L)
            .brightness(0.01)
            .saturation(1.02)
            .contrast(0.99)
            .cropTop(1).cropBottom(2).cropLeft(3).cropRight(1)
            .bitrateFactor(0.97)
            .noiseStrength(2)
            .speed(1.005)
            .frameOffset(3)
            .build();

    @Test
    void testFilterChainFollowsPipelineOrder() {
        String filter = FFmpegCommandBuilder.buildVideoFilter(params, info);

        assertThat(filter).isEqualTo("eq=brightness=0.0100:saturation=1.0200:contrast=0.9900,"
                + "crop=1076:1917:3:1,scale=1080:1920,noise=alls=2:allf=t,setpts=PTS/1.0050");
    }

    @Test
    void testFilterChainWithoutKnownDimensionsUsesExpressions() {
        VideoInfo unknown = new VideoInfo(0, 0, 0, 0, 0, "unknown");

        String filter = FFmpegCommandBuilder.buildVideoFilter(params, unknown);

        assertThat(filter).contains("crop=iw-4:ih-3:3:1", "scale=iw+4:ih+3");
    }

    @Test
    void testFormattingIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            assertThat(FFmpegCommandBuilder.buildVideoFilter(params, info)).contains("brightness=0.0100");
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void testBuildVariationCommand() {
        Path input = Paths.get("/tmp/in.mp4");
        Path output = Paths.get("/tmp/out/variation_x.mp4");

        List<String> command = FFmpegCommandBuilder.buildVariationCommand("ffmpeg", input, output, params, info,
                VariationSettings.defaults());

        assertThat(command.get(0)).isEqualTo("ffmpeg");
        assertThat(command).containsSequence("-i", input.toString());
        assertThat(command).containsSequence("-ss", "0.1000");
        assertThat(command).containsSequence("-af", "atempo=1.0050");
        assertThat(command).containsSequence("-b:v", "2328000");
        assertThat(command).containsSequence("-map_metadata", "-1");
        assertThat(command).contains("libx264", "medium", "aac", "+faststart");
        assertThat(command.get(command.size() - 1)).isEqualTo(output.toString());
    }

    @Test
    void testTargetBitrateFallsBackWhenSourceHasNone() {
        VideoInfo noBitrate = new VideoInfo(1080, 1920, 30.0, 0, 10, "h264");

        assertThat(FFmpegCommandBuilder.targetBitrate(params, noBitrate, 1_000_000L)).isEqualTo(970_000L);
    }

    @Test
    void testResolveBinaryPrefersConfiguredPath() {
        assertThat(FFmpegCommandBuilder.resolveBinary("/usr/local/bin/ffmpeg", "ffmpeg"))
                .isEqualTo("/usr/local/bin/ffmpeg");
    }

    @Test
    void testBuildProbeCommand() {
        List<String> command = FFmpegCommandBuilder.buildProbeCommand("ffprobe", Paths.get("clip.mp4"));

        assertThat(command).containsExactly("ffprobe", "-v", "quiet", "-print_format", "json",
                "-show_format", "-show_streams", "clip.mp4");
    }
}
