package com.tempo.api.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.oauth2.core.OAuth2AuthenticationException;
import org.springframework.security.oauth2.server.resource.web.BearerTokenAuthenticationEntryPoint;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * 401 with the standard Bearer challenge header plus a JSON {"detail": ...} body.
 */
@Component
public class BearerAuthenticationEntryPoint implements AuthenticationEntryPoint {

  static final String NOT_AUTHENTICATED = "Not authenticated";

  private final BearerTokenAuthenticationEntryPoint challenge = new BearerTokenAuthenticationEntryPoint();
  private final ObjectMapper json;

  public BearerAuthenticationEntryPoint(ObjectMapper json) {
    this.json = json;
  }

  @Override
  public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException ex)
      throws IOException {
    challenge.commence(request, response, ex);
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    json.writeValue(response.getOutputStream(), Map.of("detail", detail(ex)));
  }

  static String detail(AuthenticationException ex) {
    if (ex instanceof OAuth2AuthenticationException oauth) {
      String d = oauth.getError().getDescription();
      if (d != null && !d.isBlank()) return d;
    }
    return NOT_AUTHENTICATED;
  }
}
