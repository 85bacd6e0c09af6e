package io.machtrack.backend.sequence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.DynamicUpdate;

/**
 * Per-scope counter and rendering rules for machine identifiers.
 *
 * <p>{@code currentSequence} is the last number handed out. The allocator advances it with a
 * native increment (see {@link SequenceCounterStore}), so entity updates are written with
 * {@code @DynamicUpdate} and only touch the columns that actually changed.
 */
@Entity
@Table(name = "sequence_configs")
@DynamicUpdate
public class SequenceConfig {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "category_id", nullable = false, updatable = false)
  private UUID categoryId;

  @Column(name = "subcategory_id", updatable = false)
  private UUID subcategoryId;

  @Column(name = "sequence_prefix", nullable = false, length = 10)
  private String sequencePrefix;

  @Column(name = "template", nullable = false, length = 200)
  private String template;

  @Column(name = "starting_number", nullable = false)
  private long startingNumber;

  @Column(name = "current_sequence", nullable = false)
  private long currentSequence;

  @Column(name = "is_active", nullable = false)
  private boolean active;

  @Column(name = "created_by")
  private UUID createdBy;

  @Column(name = "updated_by")
  private UUID updatedBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  protected SequenceConfig() {}

  public SequenceConfig(
      SequenceScope scope,
      String sequencePrefix,
      String template,
      long startingNumber,
      UUID createdBy) {
    this.categoryId = scope.categoryId();
    this.subcategoryId = scope.subcategoryId();
    this.sequencePrefix = sequencePrefix;
    this.template = template;
    this.startingNumber = startingNumber;
    this.currentSequence = startingNumber - 1;
    this.active = true;
    this.createdBy = createdBy;
    this.updatedBy = createdBy;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public SequenceScope getScope() {
    return new SequenceScope(categoryId, subcategoryId);
  }

  public void changePrefix(String sequencePrefix, UUID actorId) {
    this.sequencePrefix = sequencePrefix;
    touch(actorId);
  }

  public void changeTemplate(String template, UUID actorId) {
    this.template = template;
    touch(actorId);
  }

  /** Sets a new starting number and rewinds the counter so the next identifier uses it. */
  public void restartAt(long startingNumber, UUID actorId) {
    this.startingNumber = startingNumber;
    this.currentSequence = startingNumber - 1;
    touch(actorId);
  }

  public void activate(UUID actorId) {
    this.active = true;
    touch(actorId);
  }

  public void deactivate(UUID actorId) {
    this.active = false;
    touch(actorId);
  }

  private void touch(UUID actorId) {
    this.updatedBy = actorId;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getCategoryId() {
    return categoryId;
  }

  public UUID getSubcategoryId() {
    return subcategoryId;
  }

  public String getSequencePrefix() {
    return sequencePrefix;
  }

  public String getTemplate() {
    return template;
  }

  public long getStartingNumber() {
    return startingNumber;
  }

  public long getCurrentSequence() {
    return currentSequence;
  }

  public boolean isActive() {
    return active;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public UUID getUpdatedBy() {
    return updatedBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public long getVersion() {
    return version;
  }
}
