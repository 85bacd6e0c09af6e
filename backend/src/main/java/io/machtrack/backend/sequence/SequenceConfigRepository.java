package io.machtrack.backend.sequence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SequenceConfigRepository extends JpaRepository<SequenceConfig, UUID> {

  @Query(
      """
      SELECT c FROM SequenceConfig c
      WHERE c.categoryId = :categoryId AND c.subcategoryId = :subcategoryId
      """)
  Optional<SequenceConfig> findBySubcategory(
      @Param("categoryId") UUID categoryId, @Param("subcategoryId") UUID subcategoryId);

  @Query(
      """
      SELECT c FROM SequenceConfig c
      WHERE c.categoryId = :categoryId AND c.subcategoryId IS NULL
      """)
  Optional<SequenceConfig> findCategoryWide(@Param("categoryId") UUID categoryId);

  @Query(
      """
      SELECT c FROM SequenceConfig c
      WHERE c.categoryId = :categoryId AND c.subcategoryId = :subcategoryId AND c.active = true
      """)
  Optional<SequenceConfig> findActiveBySubcategory(
      @Param("categoryId") UUID categoryId, @Param("subcategoryId") UUID subcategoryId);

  @Query(
      """
      SELECT c FROM SequenceConfig c
      WHERE c.categoryId = :categoryId AND c.subcategoryId IS NULL AND c.active = true
      """)
  Optional<SequenceConfig> findActiveCategoryWide(@Param("categoryId") UUID categoryId);

  List<SequenceConfig> findAllByOrderByCreatedAtDesc();

  /** Exact-scope lookup, regardless of the active flag. No fallback. */
  default Optional<SequenceConfig> findByScope(SequenceScope scope) {
    return scope.hasSubcategory()
        ? findBySubcategory(scope.categoryId(), scope.subcategoryId())
        : findCategoryWide(scope.categoryId());
  }
}
