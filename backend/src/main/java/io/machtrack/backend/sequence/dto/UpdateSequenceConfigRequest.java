package io.machtrack.backend.sequence.dto;

import jakarta.validation.constraints.Size;

/**
 * Partial update. Null fields are left as they are. {@code reformatExisting} re-renders the
 * identifiers of existing machines when the template changes. {@code dryRun} validates the update
 * and plans the reformat without writing either.
 */
public record UpdateSequenceConfigRequest(
    @Size(max = 10) String sequencePrefix,
    Long startingNumber,
    @Size(max = 200) String template,
    Boolean active,
    Boolean reformatExisting,
    Boolean dryRun) {}
