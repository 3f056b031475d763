package com.phillippitts.voicegate;

import com.phillippitts.voicegate.config.properties.CacheProperties;
import com.phillippitts.voicegate.config.properties.HealthMonitorProperties;
import com.phillippitts.voicegate.config.properties.MetricsProperties;
import com.phillippitts.voicegate.config.properties.ProviderProperties;
import com.phillippitts.voicegate.config.properties.ResilienceProperties;
import com.phillippitts.voicegate.config.properties.StorageProperties;
import com.phillippitts.voicegate.config.properties.ThreadPoolProperties;
import com.phillippitts.voicegate.config.properties.ValidationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ProviderProperties.class,
        ResilienceProperties.class,
        CacheProperties.class,
        HealthMonitorProperties.class,
        MetricsProperties.class,
        StorageProperties.class,
        ValidationProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class VoiceGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceGateApplication.class, args);
    }
}
