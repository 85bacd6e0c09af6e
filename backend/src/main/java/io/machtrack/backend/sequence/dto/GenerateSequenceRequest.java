package io.machtrack.backend.sequence.dto;

import jakarta.validation.constraints.NotNull;
import java.util.UUID;

public record GenerateSequenceRequest(
    @NotNull(message = "categoryId is required") UUID categoryId, UUID subcategoryId) {}
