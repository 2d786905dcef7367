package io.dealmotion.autopilot.settings;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AutopilotSettingsRepository extends JpaRepository<AutopilotSettings, UUID> {

  Optional<AutopilotSettings> findByUserId(UUID userId);

  List<AutopilotSettings> findByEnabledTrueOrderByUserId(Pageable pageable);
}
