package io.b2mash.hms.hmsadmin.security;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.hms.hmsadmin.TestcontainersConfiguration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
class SecurityIntegrationTest {

  @Autowired private MockMvc mockMvc;

  @Test
  void actuatorHealth_isPublic() throws Exception {
    mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
  }

  @Test
  void internalEndpoint_withoutApiKey_returns401() throws Exception {
    mockMvc.perform(get("/internal/tenants")).andExpect(status().isUnauthorized());
  }

  @Test
  void internalEndpoint_withInvalidApiKey_returns401() throws Exception {
    mockMvc
        .perform(get("/internal/tenants").header("X-API-KEY", "wrong-key"))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void internalEndpoint_withValidApiKey_passesAuth() throws Exception {
    mockMvc
        .perform(get("/internal/tenants").header("X-API-KEY", "test-api-key"))
        .andExpect(status().isOk());
  }

  @Test
  void unknownInternalPath_withValidApiKey_returns404() throws Exception {
    mockMvc
        .perform(get("/internal/nothing-here").header("X-API-KEY", "test-api-key"))
        .andExpect(status().isNotFound());
  }

  @Test
  void pathOutsideInternal_isForbidden() throws Exception {
    mockMvc.perform(get("/api/tenants")).andExpect(status().isForbidden());
  }
}
