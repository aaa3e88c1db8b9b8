package io.b2mash.memberhours.email;

/** Outcome of handing a message to an {@link EmailProvider}. */
public record SendResult(boolean success, String providerMessageId, String errorMessage) {}
