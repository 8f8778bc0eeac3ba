package com.autoposter.variation;

import lombok.Value;

import java.nio.file.Path;

@Value
public class VariationResult {
    long seed;
    VariationParameters parameters;
    Path sourcePath;
    Path outputPath;
    String contentHash;
    VideoInfo sourceInfo;
}
