package io.machtrack.backend.sequence.dto;

public record GeneratedSequenceResponse(String sequence) {}
