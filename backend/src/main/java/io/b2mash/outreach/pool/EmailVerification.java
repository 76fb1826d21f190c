package io.b2mash.outreach.pool;

public enum EmailVerification {
  VERIFIED,
  GUESSED,
  INVALID,
  CATCH_ALL,
  UNKNOWN
}
