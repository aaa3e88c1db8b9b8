package io.b2mash.memberhours.auth;

import static io.b2mash.memberhours.TestFixtures.familyMember;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.memberhours.TestcontainersConfiguration;
import io.b2mash.memberhours.credential.CredentialStore;
import io.b2mash.memberhours.directory.ProfileDirectory;
import io.b2mash.memberhours.exception.NoSuchProfileException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class AuthFlowIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private CredentialStore credentialStore;
  @MockitoBean private ProfileDirectory profileDirectory;

  @Test
  void login_singleMemberReturnsSession() throws Exception {
    credentialStore.setPassword("solo@example.org", "solo-secret-1");
    var solo = familyMember("recSolo", "Sam", "Solo", "solo@example.org", null);
    when(profileDirectory.resolve("solo@example.org")).thenReturn(List.of(solo));
    when(profileDirectory.findById("recSolo")).thenReturn(solo);

    var result =
        mockMvc
            .perform(
                post("/api/login")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(loginJson("Solo@Example.org", "solo-secret-1")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.user.id").value("recSolo"))
            .andExpect(jsonPath("$.user.name").value("Sam Solo"))
            .andReturn();
    String token = JsonPath.read(result.getResponse().getContentAsString(), "$.token");

    mockMvc
        .perform(get("/api/verify-token").header("Authorization", "Bearer " + token))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.valid").value(true))
        .andExpect(jsonPath("$.user.id").value("recSolo"));
  }

  @Test
  void login_sharedEmailRequiresSelectionUsableOnce() throws Exception {
    credentialStore.setPassword("berg@example.org", "berg-secret-1");
    var paul = familyMember("recPaul", "Paul", "Berg", "berg@example.org", "F1");
    var anna = familyMember("recAnna", "Anna", "Berg", "berg@example.org", "F1");
    when(profileDirectory.resolve("berg@example.org")).thenReturn(List.of(paul, anna));
    when(profileDirectory.findById("recAnna")).thenReturn(anna);

    var result =
        mockMvc
            .perform(
                post("/api/login")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(loginJson("berg@example.org", "berg-secret-1")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.multiple").value(true))
            .andExpect(jsonPath("$.users[0].id").value("recAnna"))
            .andExpect(jsonPath("$.users[1].id").value("recPaul"))
            .andReturn();
    String selectionToken =
        JsonPath.read(result.getResponse().getContentAsString(), "$.selection_token");

    mockMvc
        .perform(
            post("/api/select-member")
                .contentType(MediaType.APPLICATION_JSON)
                .content(selectJson("recStranger", selectionToken)))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.kind").value("CANDIDATE_NOT_IN_SET"))
        .andExpect(jsonPath("$.success").value(false));

    mockMvc
        .perform(
            post("/api/select-member")
                .contentType(MediaType.APPLICATION_JSON)
                .content(selectJson("recAnna", selectionToken)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.user.id").value("recAnna"));

    mockMvc
        .perform(
            post("/api/select-member")
                .contentType(MediaType.APPLICATION_JSON)
                .content(selectJson("recAnna", selectionToken)))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.kind").value("INVALID_SELECTION_TOKEN"));
  }

  @Test
  void login_emailMissingFromDirectoryFailsLikeWrongPassword() throws Exception {
    credentialStore.setPassword("ghost@example.org", "ghost-secret-1");
    when(profileDirectory.resolve("ghost@example.org"))
        .thenThrow(new NoSuchProfileException("none"));

    mockMvc
        .perform(
            post("/api/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content(loginJson("ghost@example.org", "ghost-secret-1")))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(jsonPath("$.kind").value("INVALID_CREDENTIAL"))
        .andExpect(jsonPath("$.message").value("Invalid email or password"));

    mockMvc
        .perform(
            post("/api/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content(loginJson("ghost@example.org", "wrong-secret")))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.kind").value("INVALID_CREDENTIAL"))
        .andExpect(jsonPath("$.message").value("Invalid email or password"));
  }

  @Test
  void forgotAndResetPassword_tokenWorksOnce() throws Exception {
    var lena = familyMember("recLena", "Lena", "Neu", "lena@example.org", null);
    when(profileDirectory.resolve("lena@example.org")).thenReturn(List.of(lena));

    var result =
        mockMvc
            .perform(
                post("/api/forgotPassword")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"email\": \"lena@example.org\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andReturn();
    String resetLink = JsonPath.read(result.getResponse().getContentAsString(), "$.resetLink");
    String token = resetLink.substring(resetLink.indexOf("token=") + 6, resetLink.indexOf("&id="));

    mockMvc
        .perform(
            post("/api/resetPassword")
                .contentType(MediaType.APPLICATION_JSON)
                .content(resetJson(token, "short")))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.kind").value("WEAK_SECRET"));

    mockMvc
        .perform(
            post("/api/resetPassword")
                .contentType(MediaType.APPLICATION_JSON)
                .content(resetJson(token, "lena-secret-1")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true));

    mockMvc
        .perform(
            post("/api/resetPassword")
                .contentType(MediaType.APPLICATION_JSON)
                .content(resetJson(token, "lena-secret-2")))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.kind").value("INVALID_RESET_TOKEN"));

    mockMvc
        .perform(
            post("/api/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content(loginJson("lena@example.org", "lena-secret-1")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true));
  }

  @Test
  void forgotPassword_unknownEmailLooksTheSame() throws Exception {
    when(profileDirectory.resolve("nobody@example.org"))
        .thenThrow(new NoSuchProfileException("none"));

    mockMvc
        .perform(
            post("/api/forgotPassword")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"email\": \"nobody@example.org\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.message").value(AuthController.RESET_REQUESTED_MESSAGE));
  }

  @Test
  void protectedEndpoint_withoutSessionIsUnauthorized() throws Exception {
    mockMvc
        .perform(get("/api/user"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.kind").value("UNAUTHORIZED"))
        .andExpect(jsonPath("$.success").value(false));

    mockMvc
        .perform(get("/api/user").header("Authorization", "Bearer not-a-jwt"))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void login_invalidBodyIsValidationError() throws Exception {
    mockMvc
        .perform(
            post("/api/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"email\": \"not-an-email\", \"password\": \"\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.kind").value("VALIDATION_ERROR"));
  }

  private static String loginJson(String email, String password) {
    return """
        {"email": "%s", "password": "%s"}
        """
        .formatted(email, password);
  }

  private static String selectJson(String memberId, String selectionToken) {
    return """
        {"member_id": "%s", "selection_token": "%s"}
        """
        .formatted(memberId, selectionToken);
  }

  private static String resetJson(String token, String password) {
    return """
        {"token": "%s", "userId": "ignored", "password": "%s"}
        """
        .formatted(token, password);
  }
}
