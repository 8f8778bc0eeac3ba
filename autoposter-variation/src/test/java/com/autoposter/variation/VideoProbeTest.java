package com.autoposter.variation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VideoProbeTest {

    @TempDir
    Path tempDir;

    private final FakeTranscoder transcoder = new FakeTranscoder();
    private final VideoProbe probe = new VideoProbe(transcoder, VariationSettings.defaults());

    @Test
    void testParsesStreamAndFormat() throws Exception {
        Path source = Files.writeString(tempDir.resolve("source.mp4"), "source");

        VideoInfo info = probe.probe(source);

        assertThat(info.getWidth()).isEqualTo(1080);
        assertThat(info.getHeight()).isEqualTo(1920);
        assertThat(info.getFps()).isEqualTo(30.0);
        assertThat(info.getBitrate()).isEqualTo(2_400_000L);
        assertThat(info.getCodec()).isEqualTo("h264");
    }

    @Test
    void testCachesRepeatedProbesOfTheSameFile() throws Exception {
        Path source = Files.writeString(tempDir.resolve("source.mp4"), "source");

        probe.probe(source);
        probe.probe(source);

        assertThat(transcoder.probeCalls.get()).isEqualTo(1);
    }

    @Test
    void testRejectsOutputWithoutVideoStream() {
        assertThatThrownBy(() -> probe.parse("{\"streams\":[{\"codec_type\":\"audio\"}]}", tempDir))
                .isInstanceOf(VariationException.class)
                .extracting("stage").isEqualTo(VariationException.Stage.PROBE);
    }

    @Test
    void testParsesFrameRates() {
        assertThat(VideoProbe.parseFrameRate("30000/1001")).isBetween(29.96, 29.98);
        assertThat(VideoProbe.parseFrameRate("25")).isEqualTo(25.0);
        assertThat(VideoProbe.parseFrameRate("0/0")).isZero();
        assertThat(VideoProbe.parseFrameRate("n/a")).isZero();
    }
}
