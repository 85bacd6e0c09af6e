package io.machtrack.backend.sequence;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tuning for the sequence engine.
 *
 * @param maxAllocationAttempts collision retries before generation fails as exhausted
 * @param templateCacheSize number of parsed templates kept in memory
 */
@ConfigurationProperties("sequence")
public record SequenceProperties(
    @DefaultValue("1000") int maxAllocationAttempts,
    @DefaultValue("1000") long templateCacheSize) {}
