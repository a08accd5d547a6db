package io.hhplus.bridge.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
    ContactUsProperties.class,
    LifetimeProperties.class
})
public class PropertiesConfig {
}
