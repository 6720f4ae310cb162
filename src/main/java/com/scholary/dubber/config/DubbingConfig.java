package com.scholary.dubber.config;

import com.scholary.dubber.mixing.MixSettings;
import com.scholary.dubber.voice.VoiceCatalogProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the dubbing pipeline.
 *
 * <p>Enables DubbingProperties and VoiceCatalogProperties and exposes the mix settings as a bean.
 */
@Configuration
@EnableConfigurationProperties({DubbingProperties.class, VoiceCatalogProperties.class})
public class DubbingConfig {

  @Bean
  public MixSettings mixSettings(DubbingProperties properties) {
    return properties.mixing();
  }
}
