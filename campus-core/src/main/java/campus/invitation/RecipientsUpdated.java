package campus.invitation;

import campus.Identifier;
import campus.event.DomainEvent;
import campus.event.EventHeader;
import campus.event.TracingCarrier;

import java.util.List;

/**
 * Emitted when the recipient list changes.
 *
 * @param addedRecipients   emails not present before the update
 * @param currentRecipients the full list after the update
 */
public record RecipientsUpdated(
    EventHeader header,
    TracingCarrier tracing,
    Identifier invitationId,
    String code,
    List<String> addedRecipients,
    List<String> currentRecipients
) implements DomainEvent {

  public RecipientsUpdated {
    addedRecipients = List.copyOf(addedRecipients);
    currentRecipients = List.copyOf(currentRecipients);
  }

  @Override
  public String streamName() {
    return StaffInvitation.EVENT_STREAM;
  }
}
