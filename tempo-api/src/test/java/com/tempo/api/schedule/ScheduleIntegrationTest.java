package com.tempo.api.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tempo.api.support.ApiClient;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Schedules over HTTP")
class ScheduleIntegrationTest {

  @Autowired MockMvc mvc;
  @Autowired ObjectMapper json;

  private ApiClient api;
  private String aliceToken;
  private String bobToken;
  private String aliceDb;

  @BeforeEach
  void setUp() throws Exception {
    api = new ApiClient(mvc, json);
    String alice = ApiClient.unique("alice");
    String bob = ApiClient.unique("bob");
    aliceToken = api.registerAndLogin(alice, alice + "@x.com", "p1");
    bobToken = api.registerAndLogin(bob, bob + "@x.com", "p2");
    aliceDb = api.read(api.postJson("/database/create", aliceToken, Map.of("name", "work"))).get("id").asText();
  }

  private Map<String, Object> entry(String databaseId, String title, String start, String end) {
    return Map.of("databaseId", databaseId, "title", title, "startsAt", start, "endsAt", end);
  }

  @Nested
  @DisplayName("create and list")
  class CreateAndList {

    @Test
    @DisplayName("creates in an owned database and lists earliest first")
    void createAndList() throws Exception {
      api.postJson("/schedule/create", aliceToken,
          entry(aliceDb, "later", "2024-05-02T09:00:00Z", "2024-05-02T10:00:00Z")).andExpect(status().isOk());
      api.postJson("/schedule/create", aliceToken,
          entry(aliceDb, "sooner", "2024-05-01T09:00:00Z", "2024-05-01T10:00:00Z")).andExpect(status().isOk());

      JsonNode list = api.read(api.get("/schedule", aliceToken).andExpect(status().isOk()));

      assertThat(list).hasSize(2);
      assertThat(list.get(0).get("title").asText()).isEqualTo("sooner");
      assertThat(list.get(1).get("title").asText()).isEqualTo("later");
    }

    @Test
    @DisplayName("another user's schedules are invisible")
    void isolation() throws Exception {
      api.postJson("/schedule/create", aliceToken,
          entry(aliceDb, "private", "2024-05-01T09:00:00Z", "2024-05-01T10:00:00Z")).andExpect(status().isOk());

      JsonNode bobList = api.read(api.get("/schedule", bobToken).andExpect(status().isOk()));

      assertThat(bobList).isEmpty();
    }

    @Test
    @DisplayName("writing into someone else's database is 403")
    void foreignDatabase() throws Exception {
      api.postJson("/schedule/create", bobToken,
              entry(aliceDb, "intrusion", "2024-05-01T09:00:00Z", "2024-05-01T10:00:00Z"))
          .andExpect(status().isForbidden())
          .andExpect(jsonPath("$.detail").value("Not the owner of this resource"));
    }

    @Test
    @DisplayName("unknown database is 404")
    void unknownDatabase() throws Exception {
      api.postJson("/schedule/create", aliceToken,
              entry(UUID.randomUUID().toString(), "x", "2024-05-01T09:00:00Z", "2024-05-01T10:00:00Z"))
          .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("end before start is 422")
    void invertedRange() throws Exception {
      api.postJson("/schedule/create", aliceToken,
              entry(aliceDb, "x", "2024-05-01T10:00:00Z", "2024-05-01T09:00:00Z"))
          .andExpect(status().isUnprocessableEntity())
          .andExpect(jsonPath("$.status_code").value(10422));
    }
  }

  @Nested
  @DisplayName("delete (open by default)")
  class OpenDelete {

    @Test
    @DisplayName("deletes by id without any token")
    void noTokenNeeded() throws Exception {
      String id = api.read(api.postJson("/schedule/create", aliceToken,
          entry(aliceDb, "gone", "2024-05-01T09:00:00Z", "2024-05-01T10:00:00Z"))).get("id").asText();

      api.postJson("/schedule/delete", null, Map.of("UUID", id))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.deleted").value(1));

      assertThat(api.read(api.get("/schedule", aliceToken))).isEmpty();
    }

    @Test
    @DisplayName("any authenticated user can delete another user's schedule")
    void noOwnerCheck() throws Exception {
      String id = api.read(api.postJson("/schedule/create", aliceToken,
          entry(aliceDb, "gone", "2024-05-01T09:00:00Z", "2024-05-01T10:00:00Z"))).get("id").asText();

      api.postJson("/schedule/delete", bobToken, Map.of("UUID", id))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.deleted").value(1));
    }

    @Test
    @DisplayName("the body is read as JSON even without a Content-Type header")
    void noContentType() throws Exception {
      String id = api.read(api.postJson("/schedule/create", aliceToken,
          entry(aliceDb, "gone", "2024-05-01T09:00:00Z", "2024-05-01T10:00:00Z"))).get("id").asText();

      api.postRaw("/schedule/delete", null, null, "{\"UUID\":\"" + id + "\"}")
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.deleted").value(1));
    }

    @Test
    @DisplayName("a body without the UUID field is 422")
    void missingId() throws Exception {
      api.postRaw("/schedule/delete", null, MediaType.TEXT_PLAIN, "{}")
          .andExpect(status().isUnprocessableEntity())
          .andExpect(jsonPath("$.status_code").value(10422));
    }

    @Test
    @DisplayName("unknown id deletes nothing")
    void unknownId() throws Exception {
      api.postJson("/schedule/delete", null, Map.of("UUID", UUID.randomUUID().toString()))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.deleted").value(0));
    }

    @Test
    @DisplayName("a malformed id is 422")
    void malformedId() throws Exception {
      api.postJson("/schedule/delete", null, Map.of("UUID", "not-a-uuid"))
          .andExpect(status().isUnprocessableEntity())
          .andExpect(jsonPath("$.status_code").value(10422));
    }
  }
}
