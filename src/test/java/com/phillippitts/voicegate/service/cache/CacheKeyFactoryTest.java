package com.phillippitts.voicegate.service.cache;

import com.phillippitts.voicegate.domain.SttRequest;
import com.phillippitts.voicegate.domain.TtsRequest;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CacheKeyFactoryTest {

    private final CacheKeyFactory keys = new CacheKeyFactory("vg");

    @Test
    void keyHasPrefixKindAndTwoDigests() {
        String key = keys.keyFor(SttRequest.of(bytes("clip"), "en"));

        assertThat(key).matches("vg:stt:[0-9a-f]{64}:[0-9a-f]{64}");
        assertThat(key.split(":")[2]).isEqualTo(CacheKeyFactory.sha256(bytes("clip")));
    }

    @Test
    void languageCaseAndAbsenceAreNormalized() {
        assertThat(keys.keyFor(SttRequest.of(bytes("clip"), "EN")))
                .isEqualTo(keys.keyFor(SttRequest.of(bytes("clip"), "en")));
        assertThat(keys.keyFor(SttRequest.of(bytes("clip"), null)))
                .isEqualTo(keys.keyFor(SttRequest.of(bytes("clip"), "auto")));
    }

    @Test
    void optionOrderDoesNotMatter() {
        Map<String, String> ab = new LinkedHashMap<>();
        ab.put("a", "1");
        ab.put("b", "2");
        Map<String, String> ba = new LinkedHashMap<>();
        ba.put("b", "2");
        ba.put("a", "1");

        assertThat(keys.keyFor(new TtsRequest("hi", "en", "alex", "mp3", ab, null, null)))
                .isEqualTo(keys.keyFor(new TtsRequest("hi", "en", "alex", "mp3", ba, null, null)));
    }

    @Test
    void tenantIsNotPartOfKey() {
        assertThat(keys.keyFor(new SttRequest(bytes("clip"), "wav", "en", Map.of(), null, "acme")))
                .isEqualTo(keys.keyFor(new SttRequest(bytes("clip"), "wav", "en", Map.of(), null, "globex")));
    }

    @Test
    void anySettingChangeProducesDifferentKey() {
        String base = keys.keyFor(new TtsRequest("hi", "en", "alex", "mp3", Map.of(), null, null));

        assertThat(keys.keyFor(new TtsRequest("hi", "en", "samantha", "mp3", Map.of(), null, null))).isNotEqualTo(base);
        assertThat(keys.keyFor(new TtsRequest("hi", "en", "alex", "wav", Map.of(), null, null))).isNotEqualTo(base);
        assertThat(keys.keyFor(new TtsRequest("hi", "en", "alex", "mp3", Map.of("speed", "2"), null, null)))
                .isNotEqualTo(base);
        assertThat(keys.keyFor(new TtsRequest("hi", "en", "alex", "mp3", Map.of(), "v2", null))).isNotEqualTo(base);
        assertThat(keys.keyFor(new TtsRequest("hi!", "en", "alex", "mp3", Map.of(), null, null))).isNotEqualTo(base);
    }

    @Test
    void sttAndTtsNeverShareKeys() {
        String stt = keys.keyFor(SttRequest.of(bytes("hi"), "en"));
        String tts = keys.keyFor(TtsRequest.of("hi", "en", null));

        assertThat(stt).startsWith("vg:stt:");
        assertThat(tts).startsWith("vg:tts:");
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
