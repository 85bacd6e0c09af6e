package io.machtrack.backend.machine;

import io.machtrack.backend.exception.InvalidStateException;
import io.machtrack.backend.exception.ResourceConflictException;
import io.machtrack.backend.exception.ResourceNotFoundException;
import io.machtrack.backend.sequence.SequenceAllocator;
import io.machtrack.backend.sequence.SequenceDecodeStrategy;
import io.machtrack.backend.sequence.SequenceScope;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Writes machine identifiers, either freshly allocated or re-rendered by a reformat. */
@Service
public class MachineSequenceService {

  private static final Logger log = LoggerFactory.getLogger(MachineSequenceService.class);

  private final MachineRepository machineRepository;
  private final MachineSequenceChangeRepository changeRepository;
  private final SequenceAllocator sequenceAllocator;

  public MachineSequenceService(
      MachineRepository machineRepository,
      MachineSequenceChangeRepository changeRepository,
      SequenceAllocator sequenceAllocator) {
    this.machineRepository = machineRepository;
    this.changeRepository = changeRepository;
    this.sequenceAllocator = sequenceAllocator;
  }

  /**
   * Generates an identifier for a machine that has none and stores it. Allocation and the machine
   * write share one transaction, so the counter row stays locked until the identifier is saved.
   */
  @Transactional
  public Machine assignSequence(UUID machineId, UUID actorId) {
    var machine = findLiveOrThrow(machineId);
    if (machine.getMachineSequence() != null) {
      throw new InvalidStateException(
          "Sequence already assigned",
          "Machine " + machineId + " already has sequence " + machine.getMachineSequence());
    }

    String sequence =
        sequenceAllocator.generate(
            new SequenceScope(machine.getCategoryId(), machine.getSubcategoryId()));
    machine.assignSequence(sequence);
    machine = machineRepository.save(machine);
    changeRepository.save(MachineSequenceChange.assigned(machine.getId(), sequence, actorId));

    log.info("Assigned machine sequence: machineId={}, sequence={}", machineId, sequence);
    return machine;
  }

  /**
   * Replaces the identifier of a live machine with its re-rendered form. Runs in its own
   * transaction so a failure affects only this machine.
   *
   * @param decodeStrategy how the number was recovered from the old identifier
   * @throws ResourceConflictException if another live machine already holds {@code newSequence}
   */
  @Transactional
  public Machine applyReformattedSequence(
      UUID machineId, String newSequence, SequenceDecodeStrategy decodeStrategy, UUID actorId) {
    var machine = findLiveOrThrow(machineId);
    boolean takenByOther =
        machineRepository.findLiveBySequence(newSequence).stream()
            .anyMatch(other -> !other.getId().equals(machineId));
    if (takenByOther) {
      throw new ResourceConflictException(
          "Sequence in use", "Sequence " + newSequence + " is already assigned to another machine");
    }

    String oldSequence = machine.getMachineSequence();
    machine.assignSequence(newSequence);
    machine = machineRepository.save(machine);
    changeRepository.save(
        MachineSequenceChange.reformatted(
            machine.getId(), oldSequence, newSequence, decodeStrategy, actorId));
    return machine;
  }

  /** Identifier writes for one machine, newest first. Includes soft-deleted machines. */
  @Transactional(readOnly = true)
  public List<MachineSequenceChange> history(UUID machineId) {
    if (!machineRepository.existsById(machineId)) {
      throw new ResourceNotFoundException("Machine", machineId);
    }
    return changeRepository.findByMachineIdOrderByChangedAtDesc(machineId);
  }

  private Machine findLiveOrThrow(UUID machineId) {
    return machineRepository
        .findLiveById(machineId)
        .orElseThrow(() -> new ResourceNotFoundException("Machine", machineId));
  }
}
