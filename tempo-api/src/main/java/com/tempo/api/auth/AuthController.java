package com.tempo.api.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tempo.domain.model.User;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
public class AuthController {

  private final AuthService auth;

  public AuthController(AuthService auth) {
    this.auth = auth;
  }

  // unknown fields (including any client-chosen id) are dropped
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record RegisterRequest(
      @NotBlank @Size(max = 100) String name,
      @NotBlank @Size(max = 320) String email,
      @NotBlank @Size(max = 100) String password
  ) {}

  public record TokenResponse(
      @JsonProperty("access_token") String accessToken,
      @JsonProperty("token_type") String tokenType
  ) {}

  public record UserResponse(UUID id, String name, String email) {
    public static UserResponse of(User user) {
      return new UserResponse(user.id(), user.name(), user.email());
    }
  }

  /**
   * OAuth2 password-style form, urlencoded or multipart: username carries an email or a user name.
   */
  @PostMapping(value = "/login",
      consumes = {MediaType.APPLICATION_FORM_URLENCODED_VALUE, MediaType.MULTIPART_FORM_DATA_VALUE},
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<TokenResponse> login(
      @RequestParam("username") String username,
      @RequestParam("password") String password
  ) {
    AccessToken token = auth.login(username, password);
    return ResponseEntity.ok(new TokenResponse(token.value(), "Bearer"));
  }

  @PostMapping(value = "/register", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterRequest req) {
    User user = auth.register(req.name(), req.email(), req.password());
    return ResponseEntity.ok(UserResponse.of(user));
  }
}
