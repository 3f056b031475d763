package com.phillippitts.voicegate;

import com.phillippitts.voicegate.domain.ProviderCategory;
import com.phillippitts.voicegate.domain.SttRequest;
import com.phillippitts.voicegate.domain.SttResponse;
import com.phillippitts.voicegate.domain.TtsRequest;
import com.phillippitts.voicegate.domain.TtsResponse;
import com.phillippitts.voicegate.exception.TransientProviderException;
import com.phillippitts.voicegate.service.orchestration.VoiceOrchestrator;
import com.phillippitts.voicegate.testutil.FakeProviderFactory;
import com.phillippitts.voicegate.testutil.FakeSttProvider;
import com.phillippitts.voicegate.testutil.FakeTtsProvider;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "voice.health.enabled=false",
        "voice.resilience.retry.max-retries=0",
        "voice.storage.base-dir=${java.io.tmpdir}/voicegate-it-audio",
        "voice.providers.stt[0].name=flaky",
        "voice.providers.stt[0].type=fake",
        "voice.providers.stt[0].priority=1",
        "voice.providers.stt[1].name=steady",
        "voice.providers.stt[1].type=fake",
        "voice.providers.stt[1].priority=2",
        "voice.providers.tts[0].name=speaker",
        "voice.providers.tts[0].type=fake"
})
@AutoConfigureMockMvc
class VoiceGateApplicationTest {

    @TestConfiguration
    static class FakeProviders {

        @Bean
        FakeProviderFactory fakeSttFactory() {
            return new FakeProviderFactory(ProviderCategory.STT)
                    .add(new FakeSttProvider("flaky").alwaysThrow(
                            new TransientProviderException("connection reset", "flaky")))
                    .add(new FakeSttProvider("steady").alwaysReturn("hello from steady"));
        }

        @Bean
        FakeProviderFactory fakeTtsFactory() {
            return new FakeProviderFactory(ProviderCategory.TTS).add(new FakeTtsProvider("speaker"));
        }
    }

    @Autowired
    VoiceOrchestrator orchestrator;

    @Autowired
    MockMvc mvc;

    @Test
    void contextLoadsWithConfiguredProviders() {
        assertThat(orchestrator.isRunning()).isTrue();
        assertThat(orchestrator.providers().descriptors()).hasSize(3);
    }

    @Test
    void sttFallsBackToNextProviderAndThenServesFromCache() {
        byte[] audio = "integration-audio".getBytes(StandardCharsets.UTF_8);

        SttResponse first = orchestrator.processStt(SttRequest.of(audio, "en"));
        SttResponse second = orchestrator.processStt(SttRequest.of(audio, "en"));

        assertThat(first.success()).isTrue();
        assertThat(first.provider()).isEqualTo("steady");
        assertThat(first.text()).isEqualTo("hello from steady");
        assertThat(first.cacheHit()).isFalse();
        assertThat(second.cacheHit()).isTrue();
        assertThat(second.text()).isEqualTo("hello from steady");
    }

    @Test
    void ttsStoresAudioAndReturnsReference() {
        TtsResponse response = orchestrator.processTts(TtsRequest.of("good morning", "en", null));

        assertThat(response.success()).isTrue();
        assertThat(response.provider()).isEqualTo("speaker");
        assertThat(response.audioRef()).startsWith("file-store://");
        assertThat(response.contentType()).isEqualTo("audio/wav");
    }

    @Test
    void providerHealthEndpointListsConfiguredProviders() throws Exception {
        mvc.perform(get("/providers/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.flaky").exists())
                .andExpect(jsonPath("$.steady").exists())
                .andExpect(jsonPath("$.speaker").exists());
    }

    @Test
    void actuatorHealthIsExposed() throws Exception {
        mvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.voiceProviders").exists());
    }
}
