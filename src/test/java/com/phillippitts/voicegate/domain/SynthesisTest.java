package com.phillippitts.voicegate.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SynthesisTest {

    @Test
    void shouldKeepBytesWhenAdapterReusesItsBuffer() {
        byte[] buffer = {4, 5, 6};
        Synthesis synthesis = Synthesis.ofBytes(buffer, "audio/wav");

        buffer[0] = 0;
        synthesis.audio()[1] = 0;

        assertThat(synthesis.audio()).containsExactly(4, 5, 6);
    }

    @Test
    void shouldDefaultContentType() {
        assertThat(Synthesis.ofReference("s3://bucket/key", null).contentType())
                .isEqualTo("application/octet-stream");
    }

    @Test
    void shouldRequireReferenceOrBytes() {
        assertThatThrownBy(() -> Synthesis.ofBytes(new byte[0], "audio/wav"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("audio reference or audio bytes");
    }
}
