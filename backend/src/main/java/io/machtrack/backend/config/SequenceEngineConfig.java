package io.machtrack.backend.config;

import io.machtrack.backend.sequence.SequenceCodec;
import io.machtrack.backend.sequence.SequenceProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SequenceProperties.class)
public class SequenceEngineConfig {

  @Bean
  SequenceCodec sequenceCodec(SequenceProperties properties) {
    return new SequenceCodec(properties.templateCacheSize());
  }
}
