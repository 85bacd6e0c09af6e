package io.machtrack.backend.machine;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Machine record as seen by the sequence engine. Soft-deleted machines keep their identifier but
 * no longer take part in uniqueness checks.
 */
@Entity
@Table(name = "machines")
public class Machine {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "category_id", nullable = false)
  private UUID categoryId;

  @Column(name = "subcategory_id")
  private UUID subcategoryId;

  @Column(name = "machine_sequence", length = 100)
  private String machineSequence;

  @Column(name = "location", nullable = false, length = 100)
  private String location;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  protected Machine() {}

  public Machine(UUID categoryId, UUID subcategoryId, String location) {
    this.categoryId = categoryId;
    this.subcategoryId = subcategoryId;
    this.location = location;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void assignSequence(String machineSequence) {
    this.machineSequence = machineSequence;
    this.updatedAt = Instant.now();
  }

  public void softDelete() {
    this.deletedAt = Instant.now();
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

  public String getMachineSequence() {
    return machineSequence;
  }

  public String getLocation() {
    return location;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }
}
