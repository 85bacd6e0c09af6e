package io.machtrack.backend.machine;

import io.machtrack.backend.sequence.SequenceDecodeStrategy;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * One write to a machine identifier. A reformat keeps the identifier it replaced and the decode
 * strategy that recovered its number, so heuristic decodes can be reviewed afterwards.
 */
@Entity
@Table(name = "machine_sequence_changes")
public class MachineSequenceChange {

  public enum Kind {
    ASSIGNED,
    REFORMATTED
  }

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "machine_id", nullable = false, updatable = false)
  private UUID machineId;

  @Enumerated(EnumType.STRING)
  @Column(name = "kind", nullable = false, updatable = false, length = 20)
  private Kind kind;

  @Column(name = "previous_sequence", updatable = false, length = 100)
  private String previousSequence;

  @Column(name = "new_sequence", nullable = false, updatable = false, length = 100)
  private String newSequence;

  @Enumerated(EnumType.STRING)
  @Column(name = "decode_strategy", updatable = false, length = 30)
  private SequenceDecodeStrategy decodeStrategy;

  @Column(name = "actor_id", updatable = false)
  private UUID actorId;

  @Column(name = "changed_at", nullable = false, updatable = false)
  private Instant changedAt;

  protected MachineSequenceChange() {}

  private MachineSequenceChange(
      UUID machineId,
      Kind kind,
      String previousSequence,
      String newSequence,
      SequenceDecodeStrategy decodeStrategy,
      UUID actorId) {
    this.machineId = machineId;
    this.kind = kind;
    this.previousSequence = previousSequence;
    this.newSequence = newSequence;
    this.decodeStrategy = decodeStrategy;
    this.actorId = actorId;
    this.changedAt = Instant.now();
  }

  public static MachineSequenceChange assigned(UUID machineId, String sequence, UUID actorId) {
    return new MachineSequenceChange(machineId, Kind.ASSIGNED, null, sequence, null, actorId);
  }

  public static MachineSequenceChange reformatted(
      UUID machineId,
      String previousSequence,
      String newSequence,
      SequenceDecodeStrategy decodeStrategy,
      UUID actorId) {
    return new MachineSequenceChange(
        machineId, Kind.REFORMATTED, previousSequence, newSequence, decodeStrategy, actorId);
  }

  public UUID getId() {
    return id;
  }

  public UUID getMachineId() {
    return machineId;
  }

  public Kind getKind() {
    return kind;
  }

  public String getPreviousSequence() {
    return previousSequence;
  }

  public String getNewSequence() {
    return newSequence;
  }

  public SequenceDecodeStrategy getDecodeStrategy() {
    return decodeStrategy;
  }

  public UUID getActorId() {
    return actorId;
  }

  public Instant getChangedAt() {
    return changedAt;
  }
}
