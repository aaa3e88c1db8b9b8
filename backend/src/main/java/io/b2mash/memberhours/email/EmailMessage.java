package io.b2mash.memberhours.email;

import java.util.Map;
import java.util.Objects;

/** Provider-agnostic email payload. */
public record EmailMessage(
    String to,
    String subject,
    String htmlBody,
    String plainTextBody,
    Map<String, String> metadata) {

  /** Validates required fields. */
  public EmailMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
