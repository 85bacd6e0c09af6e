package io.machtrack.backend.sequence;

import io.machtrack.backend.sequence.dto.CreateSequenceConfigRequest;
import io.machtrack.backend.sequence.dto.SequenceConfigResponse;
import io.machtrack.backend.sequence.dto.SequenceConfigUpdateResponse;
import io.machtrack.backend.sequence.dto.UpdateSequenceConfigRequest;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/** Create, update, reset, delete and lookup of sequence configurations. */
@Service
public class SequenceConfigService {

  private static final Logger log = LoggerFactory.getLogger(SequenceConfigService.class);

  private static final Pattern PREFIX_PATTERN = Pattern.compile("^[A-Z0-9-]{1,10}$");

  private final SequenceConfigRepository sequenceConfigRepository;
  private final ScopeSlugResolver slugResolver;
  private final SequenceCodec codec;
  private final SequenceReformatMigrator reformatMigrator;
  private final TransactionTemplate transactionTemplate;

  public SequenceConfigService(
      SequenceConfigRepository sequenceConfigRepository,
      ScopeSlugResolver slugResolver,
      SequenceCodec codec,
      SequenceReformatMigrator reformatMigrator,
      TransactionTemplate transactionTemplate) {
    this.sequenceConfigRepository = sequenceConfigRepository;
    this.slugResolver = slugResolver;
    this.codec = codec;
    this.reformatMigrator = reformatMigrator;
    this.transactionTemplate = transactionTemplate;
  }

  @Transactional(readOnly = true)
  public List<SequenceConfigResponse> listAll() {
    return sequenceConfigRepository.findAllByOrderByCreatedAtDesc().stream()
        .map(SequenceConfigResponse::from)
        .toList();
  }

  @Transactional(readOnly = true)
  public SequenceConfigResponse get(UUID id) {
    return SequenceConfigResponse.from(findOrThrow(id));
  }

  /** Exact-scope lookup. Unlike allocation, this does not fall back to the category-wide config. */
  @Transactional(readOnly = true)
  public SequenceConfigResponse findByScope(SequenceScope scope) {
    return sequenceConfigRepository
        .findByScope(scope)
        .map(SequenceConfigResponse::from)
        .orElseThrow(() -> SequenceException.configNotFound(scope));
  }

  @Transactional
  public SequenceConfigResponse create(CreateSequenceConfigRequest request, UUID actorId) {
    var scope = new SequenceScope(request.categoryId(), request.subcategoryId());
    String prefix = normalizePrefix(request.sequencePrefix());
    validateStartingNumber(request.startingNumber());
    if (request.template() == null) {
      throw SequenceException.invalidTemplate("Template is required");
    }
    codec.template(request.template()).validate();
    slugResolver.resolve(scope);

    if (sequenceConfigRepository.findByScope(scope).isPresent()) {
      throw SequenceException.duplicateConfig(scope);
    }

    var config =
        new SequenceConfig(scope, prefix, request.template(), request.startingNumber(), actorId);
    try {
      config = sequenceConfigRepository.saveAndFlush(config);
    } catch (DataIntegrityViolationException ex) {
      throw SequenceException.duplicateConfig(scope);
    }

    log.info(
        "Created sequence config: id={}, scope={}, template={}, startingNumber={}",
        config.getId(),
        scope,
        config.getTemplate(),
        config.getStartingNumber());

    return SequenceConfigResponse.from(config);
  }

  /**
   * Applies the supplied fields. A starting number that differs from the stored one rewinds the
   * counter; a template-only change keeps it. When {@code reformatExisting} is set and the template
   * changed, existing identifiers are re-rendered after the update has committed. A reformat that
   * cannot start leaves the committed update in place and is reported in {@code reformatError}.
   *
   * <p>With {@code dryRun} set the update is validated and rolled back, and the reformat is only
   * planned.
   */
  public SequenceConfigUpdateResponse update(
      UUID id, UpdateSequenceConfigRequest request, UUID actorId) {
    boolean dryRun = Boolean.TRUE.equals(request.dryRun());
    var applied =
        transactionTemplate.execute(
            tx -> {
              var result = applyUpdate(id, request, actorId, dryRun);
              if (dryRun) {
                tx.setRollbackOnly();
              }
              return result;
            });

    ReformatReport report = null;
    String reformatError = null;
    if (Boolean.TRUE.equals(request.reformatExisting()) && applied.templateChanged()) {
      try {
        report =
            dryRun
                ? reformatMigrator.preview(
                    applied.scope(), applied.oldTemplate(), applied.config().template())
                : reformatMigrator.reformat(
                    applied.scope(), applied.oldTemplate(), applied.config().template(), actorId);
      } catch (SequenceException e) {
        reformatError = e.getBody().getDetail();
        log.warn(
            "Reformat after template change did not run: id={}, code={}, reason={}",
            id,
            e.getErrorCode(),
            reformatError);
      }
    }
    return new SequenceConfigUpdateResponse(applied.config(), report, reformatError);
  }

  private AppliedUpdate applyUpdate(
      UUID id, UpdateSequenceConfigRequest request, UUID actorId, boolean dryRun) {
    var config = findOrThrow(id);
    String oldTemplate = config.getTemplate();
    var changes = new HashMap<String, Object>();

    if (request.sequencePrefix() != null) {
      String prefix = normalizePrefix(request.sequencePrefix());
      if (!prefix.equals(config.getSequencePrefix())) {
        config.changePrefix(prefix, actorId);
        changes.put("sequence_prefix", prefix);
      }
    }
    if (request.template() != null && !request.template().equals(oldTemplate)) {
      codec.template(request.template()).validate();
      config.changeTemplate(request.template(), actorId);
      changes.put("template", request.template());
    }
    if (request.startingNumber() != null) {
      validateStartingNumber(request.startingNumber());
      if (request.startingNumber() != config.getStartingNumber()) {
        config.restartAt(request.startingNumber(), actorId);
        changes.put("starting_number", request.startingNumber());
      }
    }
    if (request.active() != null && request.active() != config.isActive()) {
      if (request.active()) {
        config.activate(actorId);
      } else {
        config.deactivate(actorId);
      }
      changes.put("active", request.active());
    }

    config = sequenceConfigRepository.saveAndFlush(config);
    boolean templateChanged = !oldTemplate.equals(config.getTemplate());

    if (!changes.isEmpty()) {
      log.info(
          "{} sequence config: id={}, changes={}",
          dryRun ? "Validated update of" : "Updated",
          config.getId(),
          changes);
    }

    return new AppliedUpdate(
        SequenceConfigResponse.from(config), config.getScope(), oldTemplate, templateChanged);
  }

  /** Restarts the counter so the next identifier carries {@code newStartingNumber}. */
  @Transactional
  public SequenceConfigResponse reset(UUID id, Long newStartingNumber, UUID actorId) {
    validateStartingNumber(newStartingNumber);
    var config = findOrThrow(id);
    long previous = config.getCurrentSequence();

    config.restartAt(newStartingNumber, actorId);
    config = sequenceConfigRepository.saveAndFlush(config);

    log.info(
        "Reset sequence config: id={}, previousSequence={}, newStartingNumber={}",
        config.getId(),
        previous,
        newStartingNumber);

    return SequenceConfigResponse.from(config);
  }

  @Transactional
  public void delete(UUID id, UUID actorId) {
    var config = findOrThrow(id);

    sequenceConfigRepository.delete(config);

    log.info(
        "Deleted sequence config: id={}, scope={}, actorId={}",
        config.getId(),
        config.getScope(),
        actorId);
  }

  private SequenceConfig findOrThrow(UUID id) {
    return sequenceConfigRepository
        .findById(id)
        .orElseThrow(() -> SequenceException.configNotFound(id));
  }

  static String normalizePrefix(String prefix) {
    String normalized = prefix == null ? "" : prefix.trim().toUpperCase(Locale.ROOT);
    if (!PREFIX_PATTERN.matcher(normalized).matches()) {
      throw SequenceException.invalidPrefix(prefix);
    }
    return normalized;
  }

  private static void validateStartingNumber(Long startingNumber) {
    if (startingNumber == null || startingNumber < 1) {
      throw SequenceException.invalidStartingNumber(startingNumber);
    }
  }

  private record AppliedUpdate(
      SequenceConfigResponse config,
      SequenceScope scope,
      String oldTemplate,
      boolean templateChanged) {}
}
