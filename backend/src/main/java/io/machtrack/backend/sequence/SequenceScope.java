package io.machtrack.backend.sequence;

import java.util.Objects;
import java.util.UUID;

/**
 * Identifies a sequence counter: a category and an optional subcategory. A scope without a
 * subcategory is category-wide and acts as the fallback for subcategories that have no counter of
 * their own.
 */
public record SequenceScope(UUID categoryId, UUID subcategoryId) {

  public SequenceScope {
    Objects.requireNonNull(categoryId, "categoryId must not be null");
  }

  public static SequenceScope categoryWide(UUID categoryId) {
    return new SequenceScope(categoryId, null);
  }

  public boolean hasSubcategory() {
    return subcategoryId != null;
  }

  /** The category-wide scope of the same category. */
  public SequenceScope parent() {
    return categoryWide(categoryId);
  }

  @Override
  public String toString() {
    return hasSubcategory()
        ? "category " + categoryId + " / subcategory " + subcategoryId
        : "category " + categoryId;
  }
}
