package io.dealmotion.autopilot.lifecycle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.dealmotion.autopilot.TestcontainersConfiguration;
import io.dealmotion.autopilot.exception.ResourceConflictException;
import io.dealmotion.autopilot.exception.ResourceNotFoundException;
import io.dealmotion.autopilot.proposal.Proposal;
import io.dealmotion.autopilot.proposal.ProposalCandidate;
import io.dealmotion.autopilot.proposal.ProposalOwner;
import io.dealmotion.autopilot.proposal.ProposalStatus;
import io.dealmotion.autopilot.proposal.ProposalStore;
import io.dealmotion.autopilot.proposal.ProposalType;
import io.dealmotion.autopilot.proposal.TriggerRefs;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
class ProposalInboxServiceIntegrationTest {

  @Autowired private ProposalInboxService inboxService;
  @Autowired private ProposalLifecycleService lifecycleService;
  @Autowired private ProposalStore store;
  @Autowired private JdbcClient jdbc;

  private ProposalOwner owner;
  private UUID prospectId;

  @BeforeEach
  void setUp() {
    owner = new ProposalOwner(UUID.randomUUID(), UUID.randomUUID());
    prospectId = UUID.randomUUID();
    jdbc.sql(
            """
            INSERT INTO prospects (id, organization_id, company_name, status, created_at)
            VALUES (:id, :orgId, 'Globex', 'new', :now)
            """)
        .param("id", prospectId)
        .param("orgId", owner.organizationId())
        .param("now", Timestamp.from(Instant.now()))
        .update();
  }

  private Proposal insert(ProposalType type, int priority, TriggerRefs refs, Object... keyParts) {
    return store
        .insert(
            new Proposal(
                owner,
                new ProposalCandidate(
                    type,
                    type.dedupeKey(keyParts),
                    priority,
                    refs,
                    Map.of(),
                    Instant.now().plus(1, ChronoUnit.DAYS))))
        .orElseThrow();
  }

  private Proposal reload(Proposal proposal) {
    return store.findForOwner(proposal.getId(), owner).orElseThrow();
  }

  @Test
  void inbox_sortsPendingProposalsByPriority() {
    var refs = TriggerRefs.builder().prospect(prospectId).build();
    var research = insert(ProposalType.START_RESEARCH, 70, refs, "prospect", prospectId);
    var contacts = insert(ProposalType.ADD_CONTACTS, 85, refs, prospectId);

    var inbox = inboxService.inbox(owner);

    assertThat(inbox.proposed())
        .extracting(Proposal::getId)
        .containsExactly(contacts.getId(), research.getId());
    assertThat(inbox.counts()).containsEntry(ProposalStatus.PROPOSED, 2L);
  }

  @Test
  void inbox_autoCompletesProposalDoneOutsideAutopilot() {
    var contacts =
        insert(
            ProposalType.ADD_CONTACTS,
            80,
            TriggerRefs.builder().prospect(prospectId).build(),
            prospectId);
    jdbc.sql(
            """
            INSERT INTO prospect_contacts (id, prospect_id, organization_id, name, created_at)
            VALUES (:id, :prospectId, :orgId, 'Grace Hopper', :now)
            """)
        .param("id", UUID.randomUUID())
        .param("prospectId", prospectId)
        .param("orgId", owner.organizationId())
        .param("now", Timestamp.from(Instant.now()))
        .update();

    var inbox = inboxService.inbox(owner);

    assertThat(inbox.proposed()).isEmpty();
    var completed = reload(contacts);
    assertThat(completed.getStatus()).isEqualTo(ProposalStatus.COMPLETED);
    assertThat(completed.getExecutionResult()).containsEntry("auto_completed", true);
  }

  @Test
  void inbox_settlesProposalStuckInFlight() {
    var meetingId = UUID.randomUUID();
    var prep =
        insert(
            ProposalType.CREATE_PREP,
            75,
            TriggerRefs.builder().meeting(meetingId).build(),
            meetingId,
            "24h");
    store.transition(prep.getId(), owner, p -> p.accept(null));
    jdbc.sql("UPDATE autopilot_proposals SET decided_at = :decidedAt WHERE id = :id")
        .param("decidedAt", Timestamp.from(Instant.now().minus(1, ChronoUnit.HOURS)))
        .param("id", prep.getId())
        .update();

    var inbox = inboxService.inbox(owner);

    var failed = reload(prep);
    assertThat(failed.getStatus()).isEqualTo(ProposalStatus.FAILED);
    assertThat(failed.getError()).isEqualTo("Execution timed out after 10 minutes");
    assertThat(inbox.failed()).extracting(Proposal::getId).containsExactly(prep.getId());
    assertThat(inbox.inProgress()).isEmpty();

    var retried = lifecycleService.retry(prep.getId(), owner);
    assertThat(retried.getStatus()).isIn(ProposalStatus.ACCEPTED, ProposalStatus.EXECUTING);
    assertThat(retried.getError()).isNull();
  }

  @Test
  void history_listsTerminalProposalsOnly() {
    var refs = TriggerRefs.builder().prospect(prospectId).build();
    var declined = insert(ProposalType.START_RESEARCH, 70, refs, "prospect", prospectId);
    insert(ProposalType.ADD_CONTACTS, 80, refs, prospectId);
    lifecycleService.decline(declined.getId(), owner, "already known");

    assertThat(inboxService.history(owner, 10))
        .extracting(Proposal::getId)
        .containsExactly(declined.getId());
  }

  @Test
  void markShown_persistsFirstViewTime() {
    var research =
        insert(
            ProposalType.START_RESEARCH,
            70,
            TriggerRefs.builder().prospect(prospectId).build(),
            "prospect",
            prospectId);

    lifecycleService.markShown(research.getId(), owner);
    var firstSeen = reload(research).getViewedAt();
    lifecycleService.markShown(research.getId(), owner);

    assertThat(firstSeen).isNotNull();
    assertThat(reload(research).getViewedAt()).isEqualTo(firstSeen);
    assertThat(reload(research).getStatus()).isEqualTo(ProposalStatus.PROPOSED);
  }

  @Test
  void get_hidesProposalsOfOtherOwners() {
    var research =
        insert(
            ProposalType.START_RESEARCH,
            70,
            TriggerRefs.builder().prospect(prospectId).build(),
            "prospect",
            prospectId);
    var stranger = new ProposalOwner(UUID.randomUUID(), owner.organizationId());

    assertThat(inboxService.get(owner, research.getId()).getId()).isEqualTo(research.getId());
    assertThatThrownBy(() -> inboxService.get(stranger, research.getId()))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void inbox_holdsBackCustomerReportUntilMeetingSummaryCompleted() {
    var meetingId = UUID.randomUUID();
    var refs = TriggerRefs.builder().meeting(meetingId).build();
    var summary = insert(ProposalType.REVIEW_MEETING_SUMMARY, 90, refs, meetingId);
    var report = insert(ProposalType.REVIEW_CUSTOMER_REPORT, 85, refs, meetingId);

    assertThat(inboxService.inbox(owner).proposed())
        .extracting(Proposal::getId)
        .containsExactly(summary.getId());

    lifecycleService.completeInline(summary.getId(), owner, null);

    assertThat(inboxService.inbox(owner).proposed())
        .extracting(Proposal::getId)
        .containsExactly(report.getId());
  }

  @Test
  void retry_ofSequentialProposal_waitsForTheLiveOneToClose() {
    var firstMeeting = UUID.randomUUID();
    var secondMeeting = UUID.randomUUID();
    var first =
        insert(
            ProposalType.REVIEW_MEETING_SUMMARY,
            90,
            TriggerRefs.builder().meeting(firstMeeting).build(),
            firstMeeting);
    store.transition(first.getId(), owner, p -> p.accept(null));
    store.transition(first.getId(), p -> p.markFailed("summary service down"));
    var second =
        insert(
            ProposalType.REVIEW_MEETING_SUMMARY,
            90,
            TriggerRefs.builder().meeting(secondMeeting).build(),
            secondMeeting);

    assertThatThrownBy(() -> lifecycleService.retry(first.getId(), owner))
        .isInstanceOf(ResourceConflictException.class);
    assertThat(store.findByStatuses(owner, ProposalStatus.NON_TERMINAL))
        .filteredOn(p -> p.getType().isSequential())
        .extracting(Proposal::getId)
        .containsExactly(second.getId());

    lifecycleService.decline(second.getId(), owner, null);

    assertThat(lifecycleService.retry(first.getId(), owner).getStatus())
        .isEqualTo(ProposalStatus.ACCEPTED);
  }

  @Test
  void inbox_hidesProposalPastItsDeadlineBeforeTheSweepRuns() {
    var refs = TriggerRefs.builder().prospect(prospectId).build();
    var current = insert(ProposalType.START_RESEARCH, 70, refs, "prospect", prospectId);
    var overdue =
        store
            .insert(
                new Proposal(
                    owner,
                    new ProposalCandidate(
                        ProposalType.REACTIVATE_PROSPECT,
                        ProposalType.REACTIVATE_PROSPECT.dedupeKey(prospectId),
                        50,
                        refs,
                        Map.of(),
                        Instant.now().minus(5, ChronoUnit.MINUTES))))
            .orElseThrow();

    var inbox = inboxService.inbox(owner);

    assertThat(inbox.proposed()).extracting(Proposal::getId).containsExactly(current.getId());
    assertThat(reload(overdue).getStatus()).isEqualTo(ProposalStatus.PROPOSED);
  }
}
