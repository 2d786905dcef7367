package io.dealmotion.autopilot.proposal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.dealmotion.autopilot.TestcontainersConfiguration;
import io.dealmotion.autopilot.exception.ProposalNotFoundOrProcessedException;
import io.dealmotion.autopilot.exception.ResourceConflictException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
class JpaProposalStoreIntegrationTest {

  @Autowired private ProposalStore store;

  private static ProposalOwner newOwner() {
    return new ProposalOwner(UUID.randomUUID(), UUID.randomUUID());
  }

  private static Proposal addContacts(ProposalOwner owner, UUID prospectId) {
    return new Proposal(
        owner,
        new ProposalCandidate(
            ProposalType.ADD_CONTACTS,
            ProposalType.ADD_CONTACTS.dedupeKey(prospectId),
            80,
            TriggerRefs.builder().prospect(prospectId).build(),
            Map.of("company_name", "Acme"),
            Instant.now().plus(7, ChronoUnit.DAYS)));
  }

  @Test
  void insert_persistsProposalWithContextAndRefs() {
    var owner = newOwner();
    var prospectId = UUID.randomUUID();

    var stored = store.insert(addContacts(owner, prospectId)).orElseThrow();

    var reloaded = store.findForOwner(stored.getId(), owner).orElseThrow();
    assertThat(reloaded.getStatus()).isEqualTo(ProposalStatus.PROPOSED);
    assertThat(reloaded.getTriggerRefs().prospectId()).isEqualTo(prospectId);
    assertThat(reloaded.getContextData()).containsEntry("company_name", "Acme");
    assertThat(reloaded.getCreatedAt()).isNotNull();
  }

  @Test
  void insert_sameKeyWhileLive_isRejectedAsDuplicate() {
    var owner = newOwner();
    var prospectId = UUID.randomUUID();
    store.insert(addContacts(owner, prospectId)).orElseThrow();

    var second = store.insert(addContacts(owner, prospectId));

    assertThat(second).isEmpty();
    assertThat(store.countByStatus(owner, ProposalStatus.PROPOSED)).isEqualTo(1);
  }

  @Test
  void insert_sameKeyForAnotherOwner_isAllowed() {
    var prospectId = UUID.randomUUID();
    store.insert(addContacts(newOwner(), prospectId)).orElseThrow();

    assertThat(store.insert(addContacts(newOwner(), prospectId))).isPresent();
  }

  @Test
  void insert_afterTerminalStatus_canRaiseTheKeyAgain() {
    var owner = newOwner();
    var prospectId = UUID.randomUUID();
    var first = store.insert(addContacts(owner, prospectId)).orElseThrow();
    store.transition(first.getId(), owner, p -> p.decline("not now"));

    var second = store.insert(addContacts(owner, prospectId));

    assertThat(second).isPresent();
    assertThat(second.get().getId()).isNotEqualTo(first.getId());
    assertThat(store.findActiveDedupeKeys(owner))
        .containsExactly(ProposalType.ADD_CONTACTS.dedupeKey(prospectId));
  }

  @Test
  void transition_twice_secondAttemptIsRejected() {
    var owner = newOwner();
    var stored = store.insert(addContacts(owner, UUID.randomUUID())).orElseThrow();
    store.transition(stored.getId(), owner, p -> p.accept(null));

    assertThatThrownBy(() -> store.transition(stored.getId(), owner, p -> p.accept(null)))
        .isInstanceOf(ProposalNotFoundOrProcessedException.class);
    assertThat(store.findForOwner(stored.getId(), owner).orElseThrow().getStatus())
        .isEqualTo(ProposalStatus.ACCEPTED);
  }

  @Test
  void transition_byAnotherOwner_isRejected() {
    var owner = newOwner();
    var stored = store.insert(addContacts(owner, UUID.randomUUID())).orElseThrow();

    assertThatThrownBy(() -> store.transition(stored.getId(), newOwner(), p -> p.accept(null)))
        .isInstanceOfSatisfying(
            ProposalNotFoundOrProcessedException.class,
            e -> assertThat(e.getProposalId()).isEqualTo(stored.getId()));
  }

  @Test
  void completedTypes_areGroupedByEntity() {
    var owner = newOwner();
    var prospectId = UUID.randomUUID();
    var stored = store.insert(addContacts(owner, prospectId)).orElseThrow();
    store.transition(stored.getId(), owner, p -> p.completeInline(null));

    var completed =
        store.findCompletedTypesByEntity(owner, Instant.now().minus(1, ChronoUnit.HOURS));

    assertThat(completed)
        .containsEntry("prospect:" + prospectId, EnumSet.of(ProposalType.ADD_CONTACTS));
    assertThat(store.findDedupeKeysClosedSince(owner, Instant.now().minus(1, ChronoUnit.HOURS)))
        .contains(stored.getDedupeKey());
  }

  @Test
  void transition_withOversizedReasonAndError_storesBoundedText() {
    var owner = newOwner();
    var stored = store.insert(addContacts(owner, UUID.randomUUID())).orElseThrow();
    store.transition(stored.getId(), owner, p -> p.accept("r".repeat(600)));
    store.transition(stored.getId(), Proposal::markExecuting);

    var failed = store.transition(stored.getId(), p -> p.markFailed("x".repeat(2500)));

    assertThat(failed.getStatus()).isEqualTo(ProposalStatus.FAILED);
    var reloaded = store.findForOwner(stored.getId(), owner).orElseThrow();
    assertThat(reloaded.getStatus()).isEqualTo(ProposalStatus.FAILED);
    assertThat(reloaded.getError()).hasSize(Proposal.MAX_ERROR_LENGTH);
    assertThat(reloaded.getDecisionReason()).hasSize(Proposal.MAX_REASON_LENGTH);
  }

  @Test
  void retry_whileNewerProposalHoldsTheKey_isRejectedAsSuperseded() {
    var owner = newOwner();
    var prospectId = UUID.randomUUID();
    var first = store.insert(addContacts(owner, prospectId)).orElseThrow();
    store.transition(first.getId(), owner, p -> p.accept(null));
    store.transition(first.getId(), p -> p.markFailed("upstream 500"));
    store.insert(addContacts(owner, prospectId)).orElseThrow();

    assertThatThrownBy(() -> store.transition(first.getId(), owner, Proposal::retry))
        .isInstanceOf(ResourceConflictException.class);
    assertThat(store.findForOwner(first.getId(), owner).orElseThrow().getStatus())
        .isEqualTo(ProposalStatus.FAILED);
  }
}
