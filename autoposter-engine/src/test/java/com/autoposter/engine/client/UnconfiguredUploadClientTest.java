package com.autoposter.engine.client;

import com.autoposter.engine.exception.FatalUploadException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UnconfiguredUploadClientTest {

    private final UnconfiguredUploadClient client = new UnconfiguredUploadClient();

    @Test
    void testUploadFailsPermanently() {
        assertThatThrownBy(() -> client.upload(1L, null, "/tmp/out.mp4", "caption"))
                .isInstanceOf(FatalUploadException.class)
                .hasMessage("No upload backend configured");
    }

    @Test
    void testAuthenticationIsNeverValid() {
        assertThat(client.testAuthentication(1L)).isFalse();
    }
}
