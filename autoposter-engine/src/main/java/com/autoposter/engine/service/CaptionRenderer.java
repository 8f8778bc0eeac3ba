package com.autoposter.engine.service;

import java.nio.file.Path;

/**
 * Fills the caption placeholders {@code {index}} (1-based job position), {@code {account}}
 * and {@code {video}} (file name of the source).
 */
public final class CaptionRenderer {

    private CaptionRenderer() {
    }

    public static String render(String template, int index, String account, String videoPath) {
        if (template == null) {
            return "";
        }
        String video = videoPath == null ? "" : String.valueOf(Path.of(videoPath).getFileName());
        return template
                .replace("{index}", String.valueOf(index))
                .replace("{account}", account == null ? "" : account)
                .replace("{video}", video);
    }
}
