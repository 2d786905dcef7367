package io.dealmotion.autopilot.detection.rules;

import static io.dealmotion.autopilot.detection.rules.DetectorTestSupport.OWNER;
import static io.dealmotion.autopilot.detection.rules.DetectorTestSupport.context;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.dealmotion.autopilot.pipeline.ProspectReadRepository;
import io.dealmotion.autopilot.priority.PriorityCalculator;
import io.dealmotion.autopilot.proposal.TriggerRefs;
import io.dealmotion.autopilot.settings.OwnerSettings;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SetupCompanyProfileDetectorTest {

  private static final Instant NOW = Instant.parse("2026-03-02T08:00:00Z");

  @Mock private ProspectReadRepository prospects;

  private SetupCompanyProfileDetector detector;

  @BeforeEach
  void setUp() {
    detector = new SetupCompanyProfileDetector(new PriorityCalculator(), prospects);
  }

  @Test
  void organizationWithoutProfile_getsOneGlobalCandidate() {
    when(prospects.hasCompanyProfile(OWNER.organizationId())).thenReturn(false);

    assertThat(detector.detect(context(NOW)))
        .singleElement()
        .satisfies(
            c -> {
              assertThat(c.dedupeKey())
                  .isEqualTo("setup_company_profile:" + OWNER.organizationId());
              assertThat(c.entityKey()).isEqualTo(TriggerRefs.GLOBAL_ENTITY);
              assertThat(c.priority()).isEqualTo(90);
              assertThat(c.contextData()).containsEntry("route", "/settings/company-profile");
            });
  }

  @Test
  void organizationWithProfile_getsNothing() {
    when(prospects.hasCompanyProfile(OWNER.organizationId())).thenReturn(true);

    assertThat(detector.detect(context(NOW))).isEmpty();
  }

  @Test
  void blockedKey_skipsTheProfileLookup() {
    var key = "setup_company_profile:" + OWNER.organizationId();
    var ctx = context(NOW, OwnerSettings.defaults(3), Set.of(key), Set.of(), Map.of());

    assertThat(detector.detect(ctx)).isEmpty();
    verifyNoInteractions(prospects);
  }
}
