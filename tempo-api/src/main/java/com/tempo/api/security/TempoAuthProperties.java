package com.tempo.api.security;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Authentication settings, bound once at startup.
 *
 * IMPORTANT:
 * - jwtSecret must come from env (TEMPO_JWT_SECRET); only the dev profile may leave it blank
 * - switching passwordEncoding does not migrate stored passwords
 */
@ConfigurationProperties(prefix = "tempo.auth")
public record TempoAuthProperties(

    String jwtSecret,

    /**
     * Lifetime of issued access tokens.
     */
    @DefaultValue("30") long accessTokenMinutes,

    /**
     * How passwords are stored and compared.
     * PLAIN: stored as provided, compared by equality.
     * BCRYPT: hashed at registration, compared with BCrypt.
     */
    @DefaultValue("plain") PasswordEncoding passwordEncoding

) {

  public enum PasswordEncoding {
    PLAIN,
    BCRYPT
  }

  public Duration accessTokenTtl() {
    return Duration.ofMinutes(accessTokenMinutes);
  }
}
