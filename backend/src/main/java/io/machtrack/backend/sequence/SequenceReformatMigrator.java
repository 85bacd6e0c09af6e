package io.machtrack.backend.sequence;

import io.machtrack.backend.machine.Machine;
import io.machtrack.backend.machine.MachineRepository;
import io.machtrack.backend.machine.MachineSequenceService;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.ErrorResponseException;

/**
 * Re-renders existing machine identifiers after a template change.
 *
 * <p>Each identifier is decoded with the old template and encoded again with the new one. Writes
 * go through {@link MachineSequenceService#applyReformattedSequence}, one transaction per machine,
 * so one failure never undoes the rest. A machine whose new identifier is the current identifier
 * of another machine in the batch is written after that machine. Running the same migration twice
 * updates nothing the second time.
 */
@Service
public class SequenceReformatMigrator {

  private static final Logger log = LoggerFactory.getLogger(SequenceReformatMigrator.class);

  private final MachineRepository machineRepository;
  private final MachineSequenceService machineSequenceService;
  private final ScopeSlugResolver slugResolver;
  private final SequenceCodec codec;

  public SequenceReformatMigrator(
      MachineRepository machineRepository,
      MachineSequenceService machineSequenceService,
      ScopeSlugResolver slugResolver,
      SequenceCodec codec) {
    this.machineRepository = machineRepository;
    this.machineSequenceService = machineSequenceService;
    this.slugResolver = slugResolver;
    this.codec = codec;
  }

  public ReformatReport reformat(
      SequenceScope scope, String oldTemplate, String newTemplate, UUID actorId) {
    return run(scope, oldTemplate, newTemplate, actorId, false);
  }

  /** Plans the same migration as {@link #reformat} without writing anything. */
  public ReformatReport preview(SequenceScope scope, String oldTemplate, String newTemplate) {
    return run(scope, oldTemplate, newTemplate, null, true);
  }

  private ReformatReport run(
      SequenceScope scope, String oldTemplate, String newTemplate, UUID actorId, boolean dryRun) {
    var slugs = slugResolver.resolve(scope);
    var target = codec.template(newTemplate);
    List<Machine> machines = machineRepository.findLiveSequencedByScope(scope);

    var issues = new ArrayList<ReformatReport.Issue>();
    var changes = new ArrayList<ReformatReport.Change>();
    Map<SequenceDecodeStrategy, Integer> decodedBy = new EnumMap<>(SequenceDecodeStrategy.class);
    int unchanged = 0;
    int undecodable = 0;
    Map<Machine, PlannedWrite> planned = new LinkedHashMap<>();

    for (Machine machine : machines) {
      String current = machine.getMachineSequence();
      var decoded =
          codec.decode(current, oldTemplate, slugs.categorySlug(), slugs.subcategorySlug());
      if (decoded.isEmpty()) {
        undecodable++;
        issues.add(
            new ReformatReport.Issue(
                machine.getId(),
                current,
                ReformatReport.Outcome.UNDECODABLE,
                "No sequence number found in identifier"));
        log.warn(
            "Skipping undecodable machine sequence: machineId={}, sequence={}, template={}",
            machine.getId(),
            current,
            oldTemplate);
        continue;
      }
      var strategy = decoded.get().strategy();
      decodedBy.merge(strategy, 1, Integer::sum);
      String reformatted =
          codec.encode(
              target, slugs.categorySlug(), slugs.subcategorySlug(), decoded.get().number());
      log.debug(
          "Decoded machine sequence: machineId={}, sequence={}, number={}, strategy={}, target={}",
          machine.getId(),
          current,
          decoded.get().number(),
          strategy,
          reformatted);
      if (reformatted.equals(current)) {
        unchanged++;
      } else {
        planned.put(machine, new PlannedWrite(machine, current, reformatted, strategy));
      }
    }

    int failed = 0;
    int updated = 0;
    Set<PlannedWrite> blocked = findCollisions(machines, planned);
    for (PlannedWrite write : planned.values()) {
      if (blocked.contains(write)) {
        failed++;
        issues.add(
            issue(
                write,
                "Reformatted sequence " + write.target() + " collides with another machine"));
        log.warn(
            "Skipping colliding machine sequence: machineId={}, sequence={}, target={}",
            write.machine().getId(),
            write.current(),
            write.target());
      }
    }

    var stuck = new HashSet<PlannedWrite>();
    List<PlannedWrite> ordered = writeOrder(planned.values(), blocked, stuck);
    for (PlannedWrite write : planned.values()) {
      if (stuck.contains(write)) {
        failed++;
        issues.add(
            issue(
                write,
                "Reformatted sequence "
                    + write.target()
                    + " is held by a machine in the same batch that cannot move first"));
        log.warn(
            "Skipping blocked machine sequence: machineId={}, sequence={}, target={}",
            write.machine().getId(),
            write.current(),
            write.target());
      }
    }

    for (PlannedWrite write : ordered) {
      if (dryRun) {
        updated++;
        changes.add(write.toChange());
        continue;
      }
      try {
        machineSequenceService.applyReformattedSequence(
            write.machine().getId(), write.target(), write.strategy(), actorId);
        updated++;
        changes.add(write.toChange());
        log.info(
            "Reformatted machine sequence: machineId={}, from={}, to={}, strategy={}",
            write.machine().getId(),
            write.current(),
            write.target(),
            write.strategy());
      } catch (RuntimeException e) {
        failed++;
        String reason = failureReason(e);
        issues.add(issue(write, reason));
        log.warn(
            "Failed to reformat machine sequence: machineId={}, target={}, strategy={}, reason={}",
            write.machine().getId(),
            write.target(),
            write.strategy(),
            reason);
      }
    }

    log.info(
        "{} machine sequences: scope={}, examined={}, updated={}, unchanged={},"
            + " undecodable={}, failed={}, decodedBy={}",
        dryRun ? "Previewed reformat of" : "Reformatted",
        scope,
        machines.size(),
        updated,
        unchanged,
        undecodable,
        failed,
        decodedBy);
    return new ReformatReport(
        dryRun,
        machines.size(),
        updated,
        unchanged,
        undecodable,
        failed,
        Collections.unmodifiableMap(decodedBy),
        List.copyOf(changes),
        List.copyOf(issues));
  }

  /**
   * Planned rewrites that must not be applied: targets shared within the batch, targets held by a
   * live machine outside the batch, and targets held by a batch machine that keeps its identifier.
   */
  private Set<PlannedWrite> findCollisions(
      List<Machine> batch, Map<Machine, PlannedWrite> planned) {
    Map<String, Integer> targetCounts = new HashMap<>();
    planned.values().forEach(write -> targetCounts.merge(write.target(), 1, Integer::sum));

    Set<UUID> batchIds = new HashSet<>();
    Set<String> staying = new HashSet<>();
    for (Machine machine : batch) {
      batchIds.add(machine.getId());
      if (!planned.containsKey(machine)) {
        staying.add(machine.getMachineSequence());
      }
    }

    Set<PlannedWrite> blocked = new HashSet<>();
    for (PlannedWrite write : planned.values()) {
      String target = write.target();
      if (targetCounts.get(target) > 1 || staying.contains(target)) {
        blocked.add(write);
        continue;
      }
      boolean heldOutsideBatch =
          machineRepository.findLiveBySequence(target).stream()
              .anyMatch(other -> !batchIds.contains(other.getId()));
      if (heldOutsideBatch) {
        blocked.add(write);
      }
    }
    return blocked;
  }

  /**
   * Orders the writes so that a machine moving onto another batch machine's identifier comes after
   * that machine. Targets are unique among the writes, so dependencies form chains and cycles. A
   * chain that closes into a cycle, or that ends at a blocked write, cannot be applied; its writes
   * go into {@code stuck}.
   */
  private static List<PlannedWrite> writeOrder(
      Iterable<PlannedWrite> writes, Set<PlannedWrite> blocked, Set<PlannedWrite> stuck) {
    Map<String, PlannedWrite> byCurrent = new HashMap<>();
    writes.forEach(write -> byCurrent.put(write.current(), write));

    List<PlannedWrite> ordered = new ArrayList<>();
    Set<PlannedWrite> placed = new HashSet<>(blocked);
    for (PlannedWrite write : writes) {
      Deque<PlannedWrite> chain = new ArrayDeque<>();
      Set<PlannedWrite> onChain = new HashSet<>();
      PlannedWrite cursor = write;
      while (cursor != null && !placed.contains(cursor) && onChain.add(cursor)) {
        chain.push(cursor);
        cursor = byCurrent.get(cursor.target());
      }
      boolean cannotMove =
          cursor != null
              && (onChain.contains(cursor) || blocked.contains(cursor) || stuck.contains(cursor));
      while (!chain.isEmpty()) {
        PlannedWrite next = chain.pop();
        placed.add(next);
        if (cannotMove) {
          stuck.add(next);
        } else {
          ordered.add(next);
        }
      }
    }
    return ordered;
  }

  private static ReformatReport.Issue issue(PlannedWrite write, String reason) {
    return new ReformatReport.Issue(
        write.machine().getId(), write.current(), ReformatReport.Outcome.FAILED, reason);
  }

  private static String failureReason(RuntimeException e) {
    if (e instanceof ErrorResponseException errorResponse
        && errorResponse.getBody().getDetail() != null) {
      return errorResponse.getBody().getDetail();
    }
    return e.getMessage();
  }

  private record PlannedWrite(
      Machine machine, String current, String target, SequenceDecodeStrategy strategy) {

    ReformatReport.Change toChange() {
      return new ReformatReport.Change(machine.getId(), current(), target, strategy);
    }
  }
}
