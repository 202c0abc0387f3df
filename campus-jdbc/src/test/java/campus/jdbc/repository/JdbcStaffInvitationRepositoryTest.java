package campus.jdbc.repository;

import campus.Identifier;
import campus.MutableClock;
import campus.error.NotFoundException;
import campus.event.JacksonEventCodec;
import campus.invitation.StaffInvitation;
import campus.jdbc.TestDatabase;
import campus.model.OutboxRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcStaffInvitationRepositoryTest {

  private MutableClock clock;
  private TestDatabase db;
  private JdbcStaffInvitationRepository repository;
  private Identifier creator;

  @BeforeEach
  void setUp() {
    clock = MutableClock.at("2024-09-01T08:00:00Z");
    db = new TestDatabase(clock);
    repository = new JdbcStaffInvitationRepository(
        db.transactions, db.txContext, db.publisher, JacksonEventCodec.defaultMapper(), clock);
    creator = Identifier.newId();
  }

  @Test
  void recipientsAndWindowSurviveStorage() {
    Instant from = clock.instant().plus(Duration.ofHours(1));
    Instant until = from.plus(Duration.ofDays(7));
    StaffInvitation invitation = StaffInvitation.create(
        creator, List.of("a@example.com", "b@example.com"), from, until, clock);

    repository.save(invitation);

    StaffInvitation loaded = repository.findByCode(invitation.code()).orElseThrow();
    assertEquals(invitation.id(), loaded.id());
    assertEquals(List.of("a@example.com", "b@example.com"), loaded.recipients());
    assertEquals(from, loaded.validFrom());
    assertEquals(until, loaded.validUntil());
    assertEquals(creator, loaded.creatorId());
    assertNull(loaded.deletedAt());
  }

  @Test
  void openWindowIsStoredAsNulls() {
    StaffInvitation invitation = StaffInvitation.create(creator, List.of(), null, null, clock);

    repository.save(invitation);

    StaffInvitation loaded = repository.findById(invitation.id()).orElseThrow();
    assertTrue(loaded.recipients().isEmpty());
    assertNull(loaded.validFrom());
    assertNull(loaded.validUntil());
  }

  @Test
  void softDeleteKeepsRowAndFreezesInvitation() throws Exception {
    StaffInvitation invitation = StaffInvitation.create(creator, List.of("a@example.com"), null, null, clock);
    repository.save(invitation);

    repository.update(invitation.id(), i -> i.updateRecipients(creator, List.of("a@example.com", "c@example.com")));
    repository.update(invitation.id(), i -> i.markDeleted(creator));

    StaffInvitation loaded = repository.findById(invitation.id()).orElseThrow();
    assertTrue(loaded.isDeleted());
    assertThrows(NotFoundException.class,
        () -> repository.update(invitation.id(), i -> i.updateRecipients(creator, List.of("d@example.com"))));
    assertEquals(List.of("StaffInvitationCreated", "RecipientsUpdated", "StaffInvitationDeleted"),
        db.records(StaffInvitation.EVENT_STREAM).stream().map(OutboxRecord::eventType).toList());
  }

  @Test
  void unknownCode() {
    assertTrue(repository.findByCode("NOSUCHCODE").isEmpty());
  }
}
