package io.machtrack.backend.sequence;

/**
 * Slugs substituted into a template for one scope. {@code subcategorySlug} is {@code ""} when the
 * scope has no subcategory.
 */
public record ScopeSlugs(String categorySlug, String subcategorySlug) {}
