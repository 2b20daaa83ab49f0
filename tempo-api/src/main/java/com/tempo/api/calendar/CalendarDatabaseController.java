package com.tempo.api.calendar;

import com.tempo.domain.model.CalendarDatabase;
import com.tempo.domain.model.User;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.MediaType;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/database")
public class CalendarDatabaseController {

  private final CalendarDatabaseService databases;

  public CalendarDatabaseController(CalendarDatabaseService databases) {
    this.databases = databases;
  }

  // no owner field: ownership comes from the token
  public record CreateDatabaseRequest(
      @NotBlank @Size(max = 200) String name,
      @Size(max = 1000) String description
  ) {}

  public record DatabaseResponse(UUID id, UUID owner, String name, String description, Instant createdAt) {
    static DatabaseResponse of(CalendarDatabase db) {
      return new DatabaseResponse(db.id(), db.owner(), db.name(), db.description(), db.createdAt());
    }
  }

  @PostMapping(value = "/create", produces = MediaType.APPLICATION_JSON_VALUE)
  public DatabaseResponse create(@AuthenticationPrincipal User user, @Valid @RequestBody CreateDatabaseRequest req) {
    return DatabaseResponse.of(databases.create(user, req.name(), req.description()));
  }

  @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
  public List<DatabaseResponse> list(@AuthenticationPrincipal User user) {
    return databases.listOwned(user).stream().map(DatabaseResponse::of).toList();
  }
}
