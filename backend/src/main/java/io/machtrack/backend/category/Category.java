package io.machtrack.backend.category;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Node of the category hierarchy (levels 1 to 3). Hierarchy maintenance lives elsewhere; this
 * backend only reads categories to render sequence identifiers from their slugs.
 */
@Entity
@Table(name = "categories")
public class Category {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 100)
  private String name;

  @Column(name = "slug", nullable = false, length = 50)
  private String slug;

  @Column(name = "parent_id")
  private UUID parentId;

  @Column(name = "level", nullable = false)
  private int level;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Category() {}

  public Category(String name, String slug, UUID parentId, int level) {
    this.name = name;
    this.slug = slug;
    this.parentId = parentId;
    this.level = level;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getSlug() {
    return slug;
  }

  public UUID getParentId() {
    return parentId;
  }

  public int getLevel() {
    return level;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
