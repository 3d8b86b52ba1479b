package com.chicu.aimodelops.config;

import com.chicu.aimodelops.lifecycle.sidecar.SidecarProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({
        LifecycleProperties.class,
        SidecarProperties.class
})
public class LifecycleConfig {

    /**
     * Системные часы UTC.
     */
    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
