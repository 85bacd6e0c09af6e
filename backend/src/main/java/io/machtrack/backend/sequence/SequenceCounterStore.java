package io.machtrack.backend.sequence;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persisted per-scope counters. Resolves the counter that applies to a scope and advances it
 * atomically.
 */
@Component
public class SequenceCounterStore {

  private final SequenceConfigRepository sequenceConfigRepository;

  @PersistenceContext private EntityManager entityManager;

  public SequenceCounterStore(SequenceConfigRepository sequenceConfigRepository) {
    this.sequenceConfigRepository = sequenceConfigRepository;
  }

  /**
   * Returns the active config for the exact scope, falling back to the active category-wide config
   * when the scope names a subcategory that has none of its own.
   */
  @Transactional(readOnly = true)
  public Optional<SequenceConfig> get(SequenceScope scope) {
    if (!scope.hasSubcategory()) {
      return sequenceConfigRepository.findActiveCategoryWide(scope.categoryId());
    }
    return sequenceConfigRepository
        .findActiveBySubcategory(scope.categoryId(), scope.subcategoryId())
        .or(() -> sequenceConfigRepository.findActiveCategoryWide(scope.categoryId()));
  }

  /**
   * Reserves the next number of a counter and returns it.
   *
   * <p>A single {@code UPDATE ... RETURNING} statement, so two allocators can never read the same
   * value. The row lock it takes is held until the caller's transaction ends; a rollback releases
   * the reservation.
   *
   * @throws SequenceException with {@link SequenceErrorCode#CONFIG_NOT_FOUND} if the row is gone
   */
  @Transactional
  public long incrementAndGet(UUID configId) {
    var rows =
        entityManager
            .createNativeQuery(
                "UPDATE sequence_configs"
                    + " SET current_sequence = current_sequence + 1, updated_at = now()"
                    + " WHERE id = :id"
                    + " RETURNING current_sequence")
            .setParameter("id", configId)
            .getResultList();
    if (rows.isEmpty()) {
      throw SequenceException.configNotFound(configId);
    }
    return ((Number) rows.get(0)).longValue();
  }
}
