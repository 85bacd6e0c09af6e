package io.machtrack.backend.sequence;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome of re-rendering the identifiers of one scope after a template change. {@code changes}
 * lists the identifiers that were rewritten, or would be when {@code dryRun} is set. {@code issues}
 * lists every machine that was not updated for a reason other than already matching. {@code
 * decodedBy} counts decoded identifiers per strategy, unchanged ones included.
 */
public record ReformatReport(
    boolean dryRun,
    int examined,
    int updated,
    int unchanged,
    int undecodable,
    int failed,
    Map<SequenceDecodeStrategy, Integer> decodedBy,
    List<Change> changes,
    List<Issue> issues) {

  public enum Outcome {
    UNDECODABLE,
    FAILED
  }

  public record Change(UUID machineId, String from, String to, SequenceDecodeStrategy strategy) {}

  public record Issue(UUID machineId, String identifier, Outcome outcome, String reason) {}
}
