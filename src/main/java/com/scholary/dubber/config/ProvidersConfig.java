package com.scholary.dubber.config;

import com.scholary.dubber.provider.ProviderProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the speech and translation provider clients.
 *
 * <p>Enables the ProviderProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(ProviderProperties.class)
public class ProvidersConfig {}
