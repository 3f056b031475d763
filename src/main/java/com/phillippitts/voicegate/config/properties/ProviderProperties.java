package com.phillippitts.voicegate.config.properties;

import com.phillippitts.voicegate.domain.ProviderCategory;
import com.phillippitts.voicegate.domain.ProviderDescriptor;
import com.phillippitts.voicegate.service.provider.ProviderRegistry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static provider configuration, one list per category.
 *
 * <pre>
 * voice.providers.stt[0].name=whisper-local
 * voice.providers.stt[0].type=whisper-cli
 * voice.providers.stt[0].priority=1
 * voice.providers.stt[0].settings.binary-path=/opt/whisper/main
 * </pre>
 *
 * <p>List order is the registration order and breaks ties between equal priorities. Adapters dropped by a
 * reload stay open for {@code voice.providers.retire-grace} before a later reload closes them.
 */
@ConfigurationProperties(prefix = "voice.providers")
@Validated
public class ProviderProperties {

    @Valid
    private List<Entry> stt = new ArrayList<>();

    @Valid
    private List<Entry> tts = new ArrayList<>();

    private Duration retireGrace = ProviderRegistry.DEFAULT_RETIRE_GRACE;

    public List<Entry> getStt() {
        return stt;
    }

    public void setStt(List<Entry> stt) {
        this.stt = stt;
    }

    public List<Entry> getTts() {
        return tts;
    }

    public void setTts(List<Entry> tts) {
        this.tts = tts;
    }

    public Duration getRetireGrace() {
        return retireGrace;
    }

    public void setRetireGrace(Duration retireGrace) {
        this.retireGrace = retireGrace;
    }

    /**
     * Converts both lists into immutable descriptors, STT entries first, each list in declaration order.
     *
     * @return descriptors ready for registration
     */
    public List<ProviderDescriptor> toDescriptors() {
        List<ProviderDescriptor> out = new ArrayList<>(stt.size() + tts.size());
        stt.forEach(e -> out.add(e.toDescriptor(ProviderCategory.STT)));
        tts.forEach(e -> out.add(e.toDescriptor(ProviderCategory.TTS)));
        return out;
    }

    /**
     * One configured provider.
     */
    public static class Entry {

        @NotBlank(message = "Provider name must not be blank")
        private String name;

        /** Factory key; defaults to the name. */
        private String type;

        private int priority = 1;

        private boolean enabled = true;

        private Map<String, String> settings = new LinkedHashMap<>();

        public ProviderDescriptor toDescriptor(ProviderCategory category) {
            return new ProviderDescriptor(name, type, category, priority, enabled, settings);
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public int getPriority() {
            return priority;
        }

        public void setPriority(int priority) {
            this.priority = priority;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Map<String, String> getSettings() {
            return settings;
        }

        public void setSettings(Map<String, String> settings) {
            this.settings = settings;
        }
    }
}
