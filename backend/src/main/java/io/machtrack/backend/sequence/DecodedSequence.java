package io.machtrack.backend.sequence;

/** A number recovered from an identifier, with the strategy that recovered it. */
public record DecodedSequence(long number, SequenceDecodeStrategy strategy) {}
