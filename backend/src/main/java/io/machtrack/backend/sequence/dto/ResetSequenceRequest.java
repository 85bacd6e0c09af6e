package io.machtrack.backend.sequence.dto;

import jakarta.validation.constraints.NotNull;

public record ResetSequenceRequest(
    @NotNull(message = "newStartingNumber is required") Long newStartingNumber) {}
