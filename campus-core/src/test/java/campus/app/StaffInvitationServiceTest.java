package campus.app;

import campus.Identifier;
import campus.MutableClock;
import campus.error.AlreadyExistsException;
import campus.error.ForbiddenException;
import campus.error.InvalidInvitationException;
import campus.error.NotFoundException;
import campus.invitation.RecipientsUpdated;
import campus.invitation.StaffInvitation;
import campus.invitation.StaffInvitationCreated;
import campus.invitation.StaffInvitationDeleted;
import campus.invitation.ValidityUpdated;
import campus.spi.PasswordHasher;
import campus.user.Role;
import campus.user.Staff;
import campus.user.StaffInvitationAccepted;
import campus.user.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StaffInvitationServiceTest {

  private MutableClock clock;
  private InMemoryRepository.Invitations invitations;
  private InMemoryRepository.Users users;
  private InMemoryRepository.Staffs staff;
  private StaffInvitationService service;
  private Identifier creator;

  @BeforeEach
  void setUp() {
    clock = MutableClock.at("2024-09-01T08:00:00Z");
    invitations = new InMemoryRepository.Invitations(clock);
    users = new InMemoryRepository.Users(clock);
    staff = new InMemoryRepository.Staffs(users, clock);
    service = new StaffInvitationService(invitations, users, staff, new PlainHasher(), clock);
    creator = Identifier.newId();
  }

  @Test
  void lifecyclePublishesOneEventPerChange() {
    Identifier id = service.create(creator, List.of("a@example.com"), null, null);
    Instant from = clock.instant().plus(Duration.ofMinutes(1));
    Instant until = clock.instant().plus(Duration.ofMinutes(2));

    service.updateRecipients(creator, id, List.of("a@example.com", "b@example.com"));
    service.updateRecipients(creator, id, List.of("b@example.com", "a@example.com"));
    service.updateValidity(creator, id, from, until);
    service.updateValidity(creator, id, from, until);
    service.delete(creator, id);
    service.delete(creator, id);

    assertEquals(4, invitations.published.size());
    assertInstanceOf(StaffInvitationCreated.class, invitations.published.get(0));
    assertEquals(List.of("b@example.com"),
        assertInstanceOf(RecipientsUpdated.class, invitations.published.get(1)).addedRecipients());
    ValidityUpdated validity = assertInstanceOf(ValidityUpdated.class, invitations.published.get(2));
    assertEquals(from, validity.validFrom());
    assertEquals(until, validity.validUntil());
    assertInstanceOf(StaffInvitationDeleted.class, invitations.published.get(3));
  }

  @Test
  void onlyCreatorMayChange() {
    Identifier id = service.create(creator, List.of("a@example.com"), null, null);

    assertThrows(ForbiddenException.class,
        () -> service.updateRecipients(Identifier.newId(), id, List.of("b@example.com")));
    assertThrows(ForbiddenException.class, () -> service.delete(Identifier.newId(), id));
  }

  @Test
  void missingInvitationIsNotFound() {
    assertThrows(NotFoundException.class, () -> service.delete(creator, Identifier.newId()));
  }

  @Test
  void validateAccessByCode() {
    Identifier id = service.create(creator, List.of("a@example.com"), null, null);
    StaffInvitation invitation = invitations.findById(id).orElseThrow();

    service.validateAccess("a@example.com", invitation.code());

    assertThrows(InvalidInvitationException.class, () -> service.validateAccess("", invitation.code()));
    assertThrows(InvalidInvitationException.class, () -> service.validateAccess("b@example.com", invitation.code()));
    assertThrows(NotFoundException.class, () -> service.validateAccess("a@example.com", "NOSUCHCODE"));

    service.delete(creator, id);
    assertThrows(NotFoundException.class, () -> service.validateAccess("a@example.com", invitation.code()));
  }

  @Test
  void acceptCreatesStaffAccount() {
    Identifier invitationId = service.create(creator, List.of("grace@example.com"), null, null);
    String code = invitations.findById(invitationId).orElseThrow().code();

    Identifier staffId = service.accept("Grace@Example.com", code, "S1234567", "Grace", "Hopper", "cobol-1959");

    User user = users.findByEmail("grace@example.com").orElseThrow();
    assertEquals(staffId, user.id());
    assertEquals(Role.STAFF, user.role());
    assertEquals("plain:cobol-1959", user.passwordHash());
    assertEquals(1, staff.published.size());
    StaffInvitationAccepted accepted = assertInstanceOf(StaffInvitationAccepted.class, staff.published.get(0));
    assertEquals(staffId, accepted.staffId());
    assertEquals(invitationId, accepted.invitationId());
    assertEquals("S1234567", accepted.barcode());
    assertEquals("S1234567", accepted.username());
    assertEquals("grace@example.com", accepted.email());
    assertEquals(Staff.EVENT_STREAM, accepted.streamName());
  }

  @Test
  void acceptChecksInvitation() {
    Identifier id = service.create(creator, List.of("grace@example.com"), null, null);
    String code = invitations.findById(id).orElseThrow().code();

    assertThrows(NotFoundException.class,
        () -> service.accept("grace@example.com", "NOSUCHCODE", "S1234567", "Grace", "Hopper", "cobol-1959"));
    assertThrows(InvalidInvitationException.class,
        () -> service.accept("ada@example.com", code, "S1234567", "Ada", "Lovelace", "engine-1843"));

    service.delete(creator, id);
    assertThrows(NotFoundException.class,
        () -> service.accept("grace@example.com", code, "S1234567", "Grace", "Hopper", "cobol-1959"));
    assertTrue(staff.rows.isEmpty());
  }

  @Test
  void acceptRejectsTakenBarcode() {
    Identifier id = service.create(creator, List.of("grace@example.com", "ada@example.com"), null, null);
    String code = invitations.findById(id).orElseThrow().code();
    service.accept("ada@example.com", code, "S1234567", "Ada", "Lovelace", "engine-1843");

    AlreadyExistsException e = assertThrows(AlreadyExistsException.class,
        () -> service.accept("grace@example.com", code, "S1234567", "Grace", "Hopper", "cobol-1959"));

    assertEquals("user with this barcode already exists", e.getMessage());
    assertFalse(users.existsByEmail("grace@example.com"));
    assertThrows(AlreadyExistsException.class,
        () -> service.accept("ada@example.com", code, "S7654321", "Ada", "Lovelace", "engine-1843"));
    assertEquals(1, staff.published.size());
  }

  private static final class PlainHasher implements PasswordHasher {
    @Override
    public String hash(String plaintext) {
      return "plain:" + plaintext;
    }

    @Override
    public boolean matches(String hash, String plaintext) {
      return hash.equals(hash(plaintext));
    }
  }
}
