package com.tempo.api.schedule;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tempo.domain.model.Schedule;
import com.tempo.domain.model.User;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Valid;
import jakarta.validation.Validator;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.http.MediaType;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@RestController
@RequestMapping("/schedule")
public class ScheduleController {

  private final ScheduleService schedules;
  private final ObjectMapper json;
  private final Validator validator;

  public ScheduleController(ScheduleService schedules, ObjectMapper json, Validator validator) {
    this.schedules = schedules;
    this.json = json;
    this.validator = validator;
  }

  public record CreateScheduleRequest(
      @NotNull UUID databaseId,
      @NotBlank @Size(max = 200) String title,
      @Size(max = 2000) String description,
      @NotNull Instant startsAt,
      @NotNull Instant endsAt
  ) {
    @AssertTrue(message = "endsAt must not be before startsAt")
    public boolean isTimeRangeValid() {
      return startsAt == null || endsAt == null || !endsAt.isBefore(startsAt);
    }
  }

  public record DeleteScheduleRequest(@JsonProperty("UUID") @NotNull UUID id) {}

  public record ScheduleResponse(
      UUID id,
      UUID owner,
      UUID databaseId,
      String title,
      String description,
      Instant startsAt,
      Instant endsAt,
      Instant createdAt
  ) {
    static ScheduleResponse of(Schedule s) {
      return new ScheduleResponse(s.id(), s.owner(), s.databaseId(), s.title(), s.description(),
          s.startsAt(), s.endsAt(), s.createdAt());
    }
  }

  @PostMapping(value = "/create", produces = MediaType.APPLICATION_JSON_VALUE)
  public ScheduleResponse create(@AuthenticationPrincipal User user, @Valid @RequestBody CreateScheduleRequest req) {
    return ScheduleResponse.of(schedules.create(
        user, req.databaseId(), req.title(), req.description(), req.startsAt(), req.endsAt()));
  }

  @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
  public List<ScheduleResponse> list(@AuthenticationPrincipal User user) {
    return schedules.listOwned(user).stream().map(ScheduleResponse::of).toList();
  }

  /**
   * The body is read as JSON whatever Content-Type the client sends (or none at all).
   * user is null when the endpoint is configured as open.
   */
  @PostMapping(value = "/delete", produces = MediaType.APPLICATION_JSON_VALUE)
  public Map<String, Object> delete(@AuthenticationPrincipal User user, @RequestBody String body)
      throws JsonProcessingException {
    DeleteScheduleRequest req = json.readValue(body, DeleteScheduleRequest.class);
    if (req == null) {
      throw new ConstraintViolationException("UUID: field required", Set.of());
    }
    Set<ConstraintViolation<DeleteScheduleRequest>> violations = validator.validate(req);
    if (!violations.isEmpty()) {
      throw new ConstraintViolationException(violations);
    }
    int removed = schedules.delete(req.id(), user);
    return Map.of("deleted", removed);
  }
}
