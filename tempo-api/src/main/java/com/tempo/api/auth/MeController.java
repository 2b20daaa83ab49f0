package com.tempo.api.auth;

import com.tempo.domain.model.User;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MeController {

  /**
   * The principal is resolved from the token subject by the security chain; the password is not exposed.
   */
  @GetMapping({"/users/me/", "/users/me"})
  public AuthController.UserResponse me(@AuthenticationPrincipal User user) {
    return AuthController.UserResponse.of(user);
  }
}
