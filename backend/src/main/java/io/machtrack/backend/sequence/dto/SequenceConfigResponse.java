package io.machtrack.backend.sequence.dto;

import io.machtrack.backend.sequence.SequenceConfig;
import java.time.Instant;
import java.util.UUID;

public record SequenceConfigResponse(
    UUID id,
    UUID categoryId,
    UUID subcategoryId,
    String sequencePrefix,
    String template,
    long startingNumber,
    long currentSequence,
    boolean active,
    UUID createdBy,
    UUID updatedBy,
    Instant createdAt,
    Instant updatedAt) {

  public static SequenceConfigResponse from(SequenceConfig config) {
    return new SequenceConfigResponse(
        config.getId(),
        config.getCategoryId(),
        config.getSubcategoryId(),
        config.getSequencePrefix(),
        config.getTemplate(),
        config.getStartingNumber(),
        config.getCurrentSequence(),
        config.isActive(),
        config.getCreatedBy(),
        config.getUpdatedBy(),
        config.getCreatedAt(),
        config.getUpdatedAt());
  }
}
