package io.machtrack.backend.sequence;

import io.machtrack.backend.machine.MachineRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Hands out the next free machine identifier for a scope.
 *
 * <p>Each attempt reserves a number through {@link SequenceCounterStore#incrementAndGet}, renders
 * it, and checks it against live machines. Identifiers already taken (typically by machines that
 * were given a number by hand or before a counter reset) are skipped, so the counter can move
 * past several numbers in one call. All reservations belong to the caller's transaction.
 */
@Service
public class SequenceAllocator {

  private static final Logger log = LoggerFactory.getLogger(SequenceAllocator.class);

  private final SequenceCounterStore counterStore;
  private final ScopeSlugResolver slugResolver;
  private final MachineRepository machineRepository;
  private final SequenceCodec codec;
  private final int maxAttempts;

  public SequenceAllocator(
      SequenceCounterStore counterStore,
      ScopeSlugResolver slugResolver,
      MachineRepository machineRepository,
      SequenceCodec codec,
      SequenceProperties properties) {
    this.counterStore = counterStore;
    this.slugResolver = slugResolver;
    this.machineRepository = machineRepository;
    this.codec = codec;
    this.maxAttempts = properties.maxAllocationAttempts();
  }

  /**
   * Generates a unique identifier for {@code scope}.
   *
   * @throws SequenceException {@code CONFIG_NOT_FOUND} when neither the scope nor its category has
   *     an active config, {@code REFERENCE_NOT_FOUND} when a category is missing, {@code
   *     GENERATION_EXHAUSTED} when every attempt collided, {@code GENERATION_CANCELLED} when the
   *     thread is interrupted
   */
  @Transactional
  public String generate(SequenceScope scope) {
    var config = counterStore.get(scope).orElseThrow(() -> SequenceException.configNotFound(scope));
    var slugs = slugResolver.resolve(scope);
    var template = codec.template(config.getTemplate());

    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      if (Thread.currentThread().isInterrupted()) {
        throw SequenceException.cancelled(scope);
      }
      long number = counterStore.incrementAndGet(config.getId());
      String candidate =
          codec.encode(template, slugs.categorySlug(), slugs.subcategorySlug(), number);
      if (!machineRepository.existsLiveBySequence(candidate)) {
        log.info(
            "Generated machine sequence: scope={}, configId={}, sequence={}, attempts={}",
            scope,
            config.getId(),
            candidate,
            attempt);
        return candidate;
      }
      log.warn(
          "Sequence collision, retrying: configId={}, candidate={}, attempt={}",
          config.getId(),
          candidate,
          attempt);
    }

    log.error(
        "Sequence generation exhausted: scope={}, configId={}, attempts={}",
        scope,
        config.getId(),
        maxAttempts);
    throw SequenceException.exhausted(scope, maxAttempts);
  }
}
