package io.b2mash.memberhours.security;

import java.time.Instant;

/**
 * Identity carried by a verified session token. Passed explicitly from controllers into every
 * service call that needs to know who is acting.
 */
public record SessionClaims(String profileId, String email, Instant issuedAt, Instant expiresAt) {}
