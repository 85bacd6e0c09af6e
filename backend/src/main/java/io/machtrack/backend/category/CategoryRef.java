package io.machtrack.backend.category;

import java.util.UUID;

/** Read-only view of a category as the sequence engine needs it. */
public record CategoryRef(UUID id, String slug, UUID parentId, int level) {

  public static CategoryRef from(Category category) {
    return new CategoryRef(
        category.getId(), category.getSlug(), category.getParentId(), category.getLevel());
  }
}
