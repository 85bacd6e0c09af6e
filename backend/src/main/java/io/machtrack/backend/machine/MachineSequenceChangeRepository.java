package io.machtrack.backend.machine;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MachineSequenceChangeRepository
    extends JpaRepository<MachineSequenceChange, UUID> {

  List<MachineSequenceChange> findByMachineIdOrderByChangedAtDesc(UUID machineId);
}
