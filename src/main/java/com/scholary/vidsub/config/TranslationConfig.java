package com.scholary.vidsub.config;

import com.scholary.vidsub.translation.TranslationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TranslationProperties.class)
public class TranslationConfig {}
