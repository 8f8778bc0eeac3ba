package com.autoposter.variation;

import lombok.Value;

@Value
public class VideoInfo {
    int width;
    int height;
    double fps;
    long bitrate;
    double durationSeconds;
    String codec;

    public boolean hasDimensions() {
        return width > 0 && height > 0;
    }
}
