package io.machtrack.backend.machine.dto;

import io.machtrack.backend.machine.Machine;
import java.time.Instant;
import java.util.UUID;

public record MachineSequenceResponse(
    UUID id, UUID categoryId, UUID subcategoryId, String machineSequence, Instant updatedAt) {

  public static MachineSequenceResponse from(Machine machine) {
    return new MachineSequenceResponse(
        machine.getId(),
        machine.getCategoryId(),
        machine.getSubcategoryId(),
        machine.getMachineSequence(),
        machine.getUpdatedAt());
  }
}
