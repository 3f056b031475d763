package com.phillippitts.voicegate.service.cache;

import com.phillippitts.voicegate.domain.OperationResult;
import com.phillippitts.voicegate.domain.ProviderCategory;
import com.phillippitts.voicegate.domain.SttResponse;
import com.phillippitts.voicegate.domain.TtsResponse;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ResultCodecTest {

    private final ResultCodec codec = new ResultCodec();

    @Test
    void transcriptionKeepsPayloadAndDropsTiming() {
        byte[] bytes = codec.encode(SttResponse.success("hello", 0.9, "en", "whisper", 1234));

        Optional<OperationResult> decoded = codec.decode(bytes, ProviderCategory.STT);

        assertThat(decoded).get().isInstanceOfSatisfying(SttResponse.class, r -> {
            assertThat(r.text()).isEqualTo("hello");
            assertThat(r.confidence()).isEqualTo(0.9);
            assertThat(r.language()).isEqualTo("en");
            assertThat(r.provider()).isEqualTo("whisper");
            assertThat(r.processingMs()).isZero();
        });
    }

    @Test
    void missingOptionalFieldsStayNull() {
        byte[] bytes = codec.encode(SttResponse.success("hello", null, null, "whisper", 5));

        SttResponse decoded = (SttResponse) codec.decode(bytes, ProviderCategory.STT).orElseThrow();

        assertThat(decoded.confidence()).isNull();
        assertThat(decoded.language()).isNull();
    }

    @Test
    void synthesisKeepsReference() {
        byte[] bytes = codec.encode(TtsResponse.success("tts/abc.wav", "audio/wav", "say", 10));

        assertThat(codec.decode(bytes, ProviderCategory.TTS)).get()
                .isInstanceOfSatisfying(TtsResponse.class, r -> {
                    assertThat(r.audioRef()).isEqualTo("tts/abc.wav");
                    assertThat(r.contentType()).isEqualTo("audio/wav");
                });
    }

    @Test
    void wrongKindOrGarbageDecodesAsMiss() {
        byte[] stt = codec.encode(SttResponse.success("hello", null, null, "whisper", 5));

        assertThat(codec.decode(stt, ProviderCategory.TTS)).isEmpty();
        assertThat(codec.decode("not json".getBytes(StandardCharsets.UTF_8), ProviderCategory.STT)).isEmpty();
        assertThat(codec.decode("{\"v\":99,\"kind\":\"stt\"}".getBytes(StandardCharsets.UTF_8),
                ProviderCategory.STT)).isEmpty();
        assertThat(codec.decode("{\"v\":1,\"kind\":\"stt\",\"provider\":\"p\",\"text\":\"\"}"
                .getBytes(StandardCharsets.UTF_8), ProviderCategory.STT)).isEmpty();
    }
}
