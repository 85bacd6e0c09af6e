package io.machtrack.backend.sequence.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;

public record CreateSequenceConfigRequest(
    @NotNull(message = "categoryId is required") UUID categoryId,
    UUID subcategoryId,
    @NotBlank @Size(max = 10) String sequencePrefix,
    @NotNull(message = "startingNumber is required") Long startingNumber,
    @NotBlank @Size(max = 200) String template) {}
