package io.machtrack.backend.sequence;

import io.machtrack.backend.sequence.dto.CreateSequenceConfigRequest;
import io.machtrack.backend.sequence.dto.GenerateSequenceRequest;
import io.machtrack.backend.sequence.dto.GeneratedSequenceResponse;
import io.machtrack.backend.sequence.dto.ResetSequenceRequest;
import io.machtrack.backend.sequence.dto.SequenceConfigResponse;
import io.machtrack.backend.sequence.dto.SequenceConfigUpdateResponse;
import io.machtrack.backend.sequence.dto.UpdateSequenceConfigRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sequence-configs")
public class SequenceConfigController {

  static final String ACTOR_HEADER = "X-Actor-Id";

  private final SequenceConfigService sequenceConfigService;
  private final SequenceAllocator sequenceAllocator;

  public SequenceConfigController(
      SequenceConfigService sequenceConfigService, SequenceAllocator sequenceAllocator) {
    this.sequenceConfigService = sequenceConfigService;
    this.sequenceAllocator = sequenceAllocator;
  }

  @GetMapping
  public ResponseEntity<List<SequenceConfigResponse>> list() {
    return ResponseEntity.ok(sequenceConfigService.listAll());
  }

  @GetMapping("/{id}")
  public ResponseEntity<SequenceConfigResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(sequenceConfigService.get(id));
  }

  @GetMapping("/lookup")
  public ResponseEntity<SequenceConfigResponse> lookup(
      @RequestParam UUID categoryId, @RequestParam(required = false) UUID subcategoryId) {
    return ResponseEntity.ok(
        sequenceConfigService.findByScope(new SequenceScope(categoryId, subcategoryId)));
  }

  @PostMapping
  public ResponseEntity<SequenceConfigResponse> create(
      @Valid @RequestBody CreateSequenceConfigRequest request,
      @RequestHeader(value = ACTOR_HEADER, required = false) UUID actorId) {
    var response = sequenceConfigService.create(request, actorId);
    return ResponseEntity.created(URI.create("/api/sequence-configs/" + response.id()))
        .body(response);
  }

  @PutMapping("/{id}")
  public ResponseEntity<SequenceConfigUpdateResponse> update(
      @PathVariable UUID id,
      @Valid @RequestBody UpdateSequenceConfigRequest request,
      @RequestHeader(value = ACTOR_HEADER, required = false) UUID actorId) {
    return ResponseEntity.ok(sequenceConfigService.update(id, request, actorId));
  }

  @PostMapping("/{id}/reset")
  public ResponseEntity<SequenceConfigResponse> reset(
      @PathVariable UUID id,
      @Valid @RequestBody ResetSequenceRequest request,
      @RequestHeader(value = ACTOR_HEADER, required = false) UUID actorId) {
    return ResponseEntity.ok(
        sequenceConfigService.reset(id, request.newStartingNumber(), actorId));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(
      @PathVariable UUID id,
      @RequestHeader(value = ACTOR_HEADER, required = false) UUID actorId) {
    sequenceConfigService.delete(id, actorId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/generate")
  public ResponseEntity<GeneratedSequenceResponse> generate(
      @Valid @RequestBody GenerateSequenceRequest request) {
    String sequence =
        sequenceAllocator.generate(
            new SequenceScope(request.categoryId(), request.subcategoryId()));
    return ResponseEntity.ok(new GeneratedSequenceResponse(sequence));
  }
}
