package com.autoposter.engine.config;

import com.autoposter.engine.client.ProxyHealthChecker;
import com.autoposter.engine.client.SocketProxyHealthChecker;
import com.autoposter.engine.client.UnconfiguredUploadClient;
import com.autoposter.engine.client.UploadClient;
import com.autoposter.engine.service.WorkerPool;
import com.autoposter.variation.VariationEngine;
import com.autoposter.variation.VariationSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class EngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public VariationSettings variationSettings(
            @Value("${variation.ffmpeg-path:ffmpeg}") String ffmpegPath,
            @Value("${variation.ffprobe-path:ffprobe}") String ffprobePath,
            @Value("${variation.video-codec:libx264}") String videoCodec,
            @Value("${variation.audio-codec:aac}") String audioCodec,
            @Value("${variation.preset:medium}") String preset,
            @Value("${variation.crf:23}") int crf,
            @Value("${variation.max-concurrent-transcodes:2}") int maxConcurrentTranscodes,
            @Value("${variation.encode-timeout:PT10M}") Duration encodeTimeout) {
        return VariationSettings.builder()
                .ffmpegPath(ffmpegPath)
                .ffprobePath(ffprobePath)
                .videoCodec(videoCodec)
                .audioCodec(audioCodec)
                .preset(preset)
                .crf(crf)
                .maxConcurrentTranscodes(maxConcurrentTranscodes)
                .encodeTimeout(encodeTimeout)
                .build();
    }

    @Bean
    public VariationEngine variationEngine(VariationSettings variationSettings) {
        return new VariationEngine(variationSettings);
    }

    @Bean(destroyMethod = "shutdown")
    public WorkerPool workerPool(@Value("${dispatcher.worker-pool-size:5}") int size) {
        return new WorkerPool(size);
    }

    @Bean
    @ConditionalOnMissingBean
    public UploadClient uploadClient() {
        return new UnconfiguredUploadClient();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProxyHealthChecker proxyHealthChecker(Clock clock,
                                                 @Value("${proxy-check.connect-timeout:PT5S}") Duration connectTimeout) {
        return new SocketProxyHealthChecker(clock, connectTimeout);
    }
}
