package com.tempo.api.auth;

import com.tempo.api.security.TempoAuthProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Issues stateless HS256 access tokens whose subject is the user's email.
 * Nothing is stored; a token is valid until its exp passes.
 */
@Service
public class AccessTokenService {

  private static final Logger log = LoggerFactory.getLogger(AccessTokenService.class);

  private final JwtEncoder jwtEncoder;
  private final Clock clock;
  private final Duration defaultTtl;

  @Autowired
  public AccessTokenService(JwtEncoder jwtEncoder, Clock clock, TempoAuthProperties props) {
    this(jwtEncoder, clock, props.accessTokenTtl());
  }

  public AccessTokenService(JwtEncoder jwtEncoder, Clock clock, Duration defaultTtl) {
    this.jwtEncoder = jwtEncoder;
    this.clock = clock;
    this.defaultTtl = defaultTtl;
  }

  public AccessToken issue(String subject) {
    return issue(subject, defaultTtl);
  }

  public AccessToken issue(String subject, Duration ttl) {
    if (subject == null || subject.isBlank()) {
      throw new IllegalArgumentException("Token subject must not be blank");
    }
    Instant now = clock.instant();
    Instant exp = now.plus(ttl);

    var claims = JwtClaimsSet.builder()
        .subject(subject)
        .issuedAt(now)
        .expiresAt(exp)
        .build();

    // Pin HS256 so the encoder does not have to guess the algorithm from the key.
    final String value;
    try {
      value = jwtEncoder.encode(
          JwtEncoderParameters.from(JwsHeader.with(MacAlgorithm.HS256).build(), claims)
      ).getTokenValue();
    } catch (RuntimeException e) {
      log.error("JWT encode failed (check tempo.auth.jwt-secret)", e);
      throw e;
    }
    return new AccessToken(value, exp);
  }
}
