package io.machtrack.backend.sequence.dto;

import io.machtrack.backend.sequence.ReformatReport;

/**
 * Updated config plus the reformat report. {@code reformat} is null when no migration ran; {@code
 * reformatError} says why when one was requested but could not start.
 */
public record SequenceConfigUpdateResponse(
    SequenceConfigResponse config, ReformatReport reformat, String reformatError) {}
