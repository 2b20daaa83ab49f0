package com.tempo.api.auth;

import java.time.Instant;

public record AccessToken(String value, Instant expiresAt) {

  @Override
  public String toString() {
    return "AccessToken[expiresAt=" + expiresAt + "]";
  }
}
