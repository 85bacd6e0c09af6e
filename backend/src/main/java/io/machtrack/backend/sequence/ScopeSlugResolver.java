package io.machtrack.backend.sequence;

import io.machtrack.backend.category.CategoryLookupService;
import io.machtrack.backend.category.CategoryRef;
import org.springframework.stereotype.Component;

/** Resolves the slugs a template is rendered with for a given scope. */
@Component
public class ScopeSlugResolver {

  private final CategoryLookupService categoryLookupService;

  public ScopeSlugResolver(CategoryLookupService categoryLookupService) {
    this.categoryLookupService = categoryLookupService;
  }

  /**
   * @throws SequenceException {@code REFERENCE_NOT_FOUND} if the category or subcategory is gone
   */
  public ScopeSlugs resolve(SequenceScope scope) {
    CategoryRef category =
        categoryLookupService
            .getCategory(scope.categoryId())
            .orElseThrow(() -> SequenceException.referenceNotFound("category", scope.categoryId()));
    if (!scope.hasSubcategory()) {
      return new ScopeSlugs(category.slug(), "");
    }
    CategoryRef subcategory =
        categoryLookupService
            .getCategory(scope.subcategoryId())
            .orElseThrow(
                () -> SequenceException.referenceNotFound("subcategory", scope.subcategoryId()));
    return new ScopeSlugs(category.slug(), subcategory.slug());
  }
}
