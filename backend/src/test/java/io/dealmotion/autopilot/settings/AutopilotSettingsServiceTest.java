package io.dealmotion.autopilot.settings;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.dealmotion.autopilot.audit.AuditEventRecord;
import io.dealmotion.autopilot.audit.AuditService;
import io.dealmotion.autopilot.config.AutopilotProperties;
import io.dealmotion.autopilot.exception.InvalidStateException;
import io.dealmotion.autopilot.proposal.ProposalOwner;
import java.util.Arrays;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AutopilotSettingsServiceTest {

  private static final ProposalOwner OWNER =
      new ProposalOwner(UUID.randomUUID(), UUID.randomUUID());

  @Mock private AutopilotSettingsRepository settingsRepository;
  @Mock private AuditService auditService;

  private AutopilotSettingsService service;

  @BeforeEach
  void setUp() {
    service =
        new AutopilotSettingsService(
            settingsRepository, auditService, AutopilotProperties.defaults());
  }

  private static SettingsUpdate maxConcurrent(int value) {
    return new SettingsUpdate(null, null, null, null, null, null, null, value, null);
  }

  @Test
  void resolve_withoutStoredRow_returnsDefaultsWithoutPersisting() {
    when(settingsRepository.findByUserId(OWNER.userId())).thenReturn(Optional.empty());

    var settings = service.resolve(OWNER);

    assertThat(settings.enabled()).isTrue();
    assertThat(settings.maxConcurrentProposals()).isEqualTo(2);
    assertThat(settings.outreachCooldownDays()).isEqualTo(14);
    assertThat(settings.excludedMeetingKeywords()).contains("standup");
    verify(settingsRepository, never()).save(any());
  }

  @Test
  void update_firstWrite_createsRowAndAudits() {
    when(settingsRepository.findByUserId(OWNER.userId())).thenReturn(Optional.empty());
    when(settingsRepository.save(any(AutopilotSettings.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));

    var settings = service.update(OWNER, maxConcurrent(4));

    assertThat(settings.maxConcurrentProposals()).isEqualTo(4);
    assertThat(settings.prepReminderHours()).isEqualTo(24);

    var audit = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(audit.capture());
    assertThat(audit.getValue().eventType()).isEqualTo("autopilot_settings.updated");
    assertThat(audit.getValue().actorId()).isEqualTo(OWNER.userId());
    assertThat(audit.getValue().details()).containsEntry("max_concurrent_proposals", 4);
  }

  @Test
  void update_normalizesExcludedKeywords() {
    when(settingsRepository.findByUserId(OWNER.userId())).thenReturn(Optional.empty());
    when(settingsRepository.save(any(AutopilotSettings.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));
    var update =
        new SettingsUpdate(
            null,
            null,
            null,
            null,
            null,
            null,
            Arrays.asList(" Internal ", "internal", "", null, "Board"),
            null,
            null);

    var settings = service.update(OWNER, update);

    assertThat(settings.excludedMeetingKeywords()).containsExactly("internal", "board");
  }

  @Test
  void update_outOfRange_isRejectedWithoutWriting() {
    assertThatThrownBy(() -> service.update(OWNER, maxConcurrent(0)))
        .isInstanceOf(InvalidStateException.class);
    assertThatThrownBy(() -> service.update(OWNER, maxConcurrent(11)))
        .isInstanceOf(InvalidStateException.class);

    verifyNoInteractions(settingsRepository, auditService);
  }
}
