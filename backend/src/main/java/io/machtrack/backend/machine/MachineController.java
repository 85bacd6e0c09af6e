package io.machtrack.backend.machine;

import io.machtrack.backend.machine.dto.MachineSequenceChangeResponse;
import io.machtrack.backend.machine.dto.MachineSequenceResponse;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/machines")
public class MachineController {

  private final MachineSequenceService machineSequenceService;

  public MachineController(MachineSequenceService machineSequenceService) {
    this.machineSequenceService = machineSequenceService;
  }

  @PostMapping("/{id}/sequence")
  public ResponseEntity<MachineSequenceResponse> assignSequence(
      @PathVariable UUID id, @RequestHeader(value = "X-Actor-Id", required = false) UUID actorId) {
    var machine = machineSequenceService.assignSequence(id, actorId);
    return ResponseEntity.ok(MachineSequenceResponse.from(machine));
  }

  @GetMapping("/{id}/sequence-history")
  public ResponseEntity<List<MachineSequenceChangeResponse>> sequenceHistory(
      @PathVariable UUID id) {
    return ResponseEntity.ok(
        machineSequenceService.history(id).stream()
            .map(MachineSequenceChangeResponse::from)
            .toList());
  }
}
