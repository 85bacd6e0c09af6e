package io.machtrack.backend.machine;

import io.machtrack.backend.sequence.SequenceScope;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MachineRepository extends JpaRepository<Machine, UUID> {

  @Query("SELECT m FROM Machine m WHERE m.id = :id AND m.deletedAt IS NULL")
  Optional<Machine> findLiveById(@Param("id") UUID id);

  /** Uniqueness check for candidate identifiers. Deleted machines do not count. */
  @Query(
      "SELECT COUNT(m) > 0 FROM Machine m"
          + " WHERE m.machineSequence = :sequence AND m.deletedAt IS NULL")
  boolean existsLiveBySequence(@Param("sequence") String sequence);

  @Query("SELECT m FROM Machine m WHERE m.machineSequence = :sequence AND m.deletedAt IS NULL")
  List<Machine> findLiveBySequence(@Param("sequence") String sequence);

  @Query(
      """
      SELECT m FROM Machine m
      WHERE m.categoryId = :categoryId
        AND m.subcategoryId = :subcategoryId
        AND m.machineSequence IS NOT NULL
        AND m.deletedAt IS NULL
      ORDER BY m.createdAt ASC
      """)
  List<Machine> findLiveSequencedBySubcategory(
      @Param("categoryId") UUID categoryId, @Param("subcategoryId") UUID subcategoryId);

  @Query(
      """
      SELECT m FROM Machine m
      WHERE m.categoryId = :categoryId
        AND m.subcategoryId IS NULL
        AND m.machineSequence IS NOT NULL
        AND m.deletedAt IS NULL
      ORDER BY m.createdAt ASC
      """)
  List<Machine> findLiveSequencedWithoutSubcategory(@Param("categoryId") UUID categoryId);

  /**
   * Live machines carrying an identifier whose scope matches exactly. A category-wide scope matches
   * only machines without a subcategory.
   */
  default List<Machine> findLiveSequencedByScope(SequenceScope scope) {
    return scope.hasSubcategory()
        ? findLiveSequencedBySubcategory(scope.categoryId(), scope.subcategoryId())
        : findLiveSequencedWithoutSubcategory(scope.categoryId());
  }
}
