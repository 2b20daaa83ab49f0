package com.tempo.api.security;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.OctetSequenceKey;
import com.nimbusds.jose.jwk.source.ImmutableJWKSet;
import com.nimbusds.jose.jwk.source.JWKSource;
import com.nimbusds.jose.proc.SecurityContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.*;

@Configuration
public class JwtBeans {

  static final String DEV_SECRET = "dev-secret-change-me";

  private final Environment env;
  private final TempoAuthProperties props;

  public JwtBeans(Environment env, TempoAuthProperties props) {
    this.env = env;
    this.props = props;
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public PasswordEncoder passwordEncoder() {
    return switch (props.passwordEncoding()) {
      case BCRYPT -> new BCryptPasswordEncoder();
      case PLAIN -> new PlainTextPasswordEncoder();
    };
  }

  @Bean
  public JwtEncoder jwtEncoder() {
    return encoder(signingKey());
  }

  @Bean
  public JwtDecoder jwtDecoder(Clock clock) {
    return decoder(signingKey(), clock);
  }

  public static JwtEncoder encoder(byte[] keyBytes) {
    var jwk = new OctetSequenceKey.Builder(keyBytes)
        .algorithm(JWSAlgorithm.HS256)
        .keyID("tempo-hs256")
        .build();

    JWKSource<SecurityContext> jwkSource = new ImmutableJWKSet<>(new JWKSet(jwk));
    return new NimbusJwtEncoder(jwkSource);
  }

  /**
   * HS256 only, exp strictly in the future (no clock skew), non-blank sub.
   */
  public static JwtDecoder decoder(byte[] keyBytes, Clock clock) {
    var key = new SecretKeySpec(keyBytes, "HmacSHA256");
    NimbusJwtDecoder decoder = NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
    decoder.setJwtValidator(new DelegatingOAuth2TokenValidator<>(
        new ExpiryValidator(clock),
        new JwtClaimValidator<String>(JwtClaimNames.SUB, sub -> sub != null && !sub.isBlank())
    ));
    return decoder;
  }

  /**
   * Any configured secret string is reduced to a fixed 32-byte HMAC key with SHA-256.
   */
  public static byte[] deriveKey(String secret) {
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      return md.digest(secret.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  private byte[] signingKey() {
    String s = props.jwtSecret() == null ? "" : props.jwtSecret().trim();
    if (s.isEmpty()) {
      if (env.acceptsProfiles(Profiles.of("dev"))) {
        s = DEV_SECRET;
      } else {
        throw new IllegalStateException("tempo.auth.jwt-secret is empty. Set TEMPO_JWT_SECRET.");
      }
    }
    return deriveKey(s);
  }
}
