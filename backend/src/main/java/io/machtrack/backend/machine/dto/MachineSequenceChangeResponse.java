package io.machtrack.backend.machine.dto;

import io.machtrack.backend.machine.MachineSequenceChange;
import io.machtrack.backend.sequence.SequenceDecodeStrategy;
import java.time.Instant;
import java.util.UUID;

public record MachineSequenceChangeResponse(
    UUID id,
    MachineSequenceChange.Kind kind,
    String previousSequence,
    String newSequence,
    SequenceDecodeStrategy decodeStrategy,
    UUID actorId,
    Instant changedAt) {

  public static MachineSequenceChangeResponse from(MachineSequenceChange change) {
    return new MachineSequenceChangeResponse(
        change.getId(),
        change.getKind(),
        change.getPreviousSequence(),
        change.getNewSequence(),
        change.getDecodeStrategy(),
        change.getActorId(),
        change.getChangedAt());
  }
}
