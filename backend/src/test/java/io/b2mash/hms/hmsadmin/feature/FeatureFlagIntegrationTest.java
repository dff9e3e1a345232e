package io.b2mash.hms.hmsadmin.feature;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.hms.hmsadmin.TestcontainersConfiguration;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class FeatureFlagIntegrationTest {

  private static final String API_KEY = "test-api-key";

  @Autowired private MockMvc mockMvc;

  private String basicTenant;
  private String basicTenantUuid;

  @BeforeAll
  void provisionTenant() throws Exception {
    var result =
        mockMvc
            .perform(
                post("/internal/tenants")
                    .header("X-API-KEY", API_KEY)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {
                          "name": "Flag Motel",
                          "email": "ops@flag-motel.example",
                          "plan": "Basic",
                          "subdomain": "flag-motel"
                        }
                        """))
            .andExpect(status().isCreated())
            .andReturn();
    basicTenant = JsonPath.read(result.getResponse().getContentAsString(), "$.tenant.id");
    basicTenantUuid = JsonPath.read(result.getResponse().getContentAsString(), "$.tenant.uuid");
  }

  @Test
  void shouldCreateFlagAndRejectDuplicateKey() throws Exception {
    mockMvc
        .perform(
            post("/internal/feature-flags")
                .header("X-API-KEY", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"key": "night_audit", "name": "Night audit", "category": "operations"}
                    """))
        .andExpect(status().isCreated())
        .andExpect(header().string("Location", "/internal/feature-flags/night_audit"))
        .andExpect(jsonPath("$.status").value("enabled"))
        .andExpect(jsonPath("$.scope").value("global"));

    mockMvc
        .perform(
            post("/internal/feature-flags")
                .header("X-API-KEY", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"key": "night_audit", "name": "Night audit again"}
                    """))
        .andExpect(status().isConflict());

    mockMvc
        .perform(
            get("/internal/feature-flags")
                .header("X-API-KEY", API_KEY)
                .param("category", "operations"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[*].key", hasItem("night_audit")));
  }

  @Test
  void shouldApplyPlanEntitlementThenTenantOverride() throws Exception {
    createFlag(
        """
        {"key": "loyalty_points", "name": "Loyalty points", "enabledForPlans": ["Enterprise"]}
        """);

    evaluate("loyalty_points", basicTenant, false, "PLAN_NOT_ENTITLED");

    mockMvc
        .perform(
            post("/internal/feature-flags/loyalty_points/plans")
                .header("X-API-KEY", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"plan": "Basic", "enabled": true}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.enabledForPlans", contains("Enterprise", "Basic")));

    evaluate("loyalty_points", basicTenant, true, "STATUS");

    mockMvc
        .perform(
            post("/internal/feature-flags/loyalty_points/tenants")
                .header("X-API-KEY", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"tenant_id": "%s", "enabled": false}
                    """
                        .formatted(basicTenantUuid)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.disabledForTenants", contains(basicTenant)));

    evaluate("loyalty_points", basicTenantUuid, false, "DENY_LIST");
  }

  @Test
  void shouldListAndToggleTenantFeatures() throws Exception {
    createFlag(
        """
        {"key": "channel_manager", "name": "Channel manager", "rolloutPercentage": 0}
        """);

    mockMvc
        .perform(
            get("/internal/tenants/" + basicTenant + "/features").header("X-API-KEY", API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[?(@.key == 'channel_manager')].enabled", contains(false)))
        .andExpect(jsonPath("$[?(@.key == 'channel_manager')].rule", contains("ROLLOUT")));

    mockMvc
        .perform(
            put("/internal/tenants/" + basicTenant + "/features")
                .header("X-API-KEY", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"features": [
                      {"key": "channel_manager", "enabled": true},
                      {"key": "no_such_flag", "enabled": true}
                    ]}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[?(@.key == 'channel_manager')].enabled", contains(true)))
        .andExpect(jsonPath("$[?(@.key == 'channel_manager')].rule", contains("ALLOW_LIST")));
  }

  @Test
  void shouldEvaluateUnknownTenantAndMissingFlag() throws Exception {
    createFlag("""
        {"key": "spa_booking", "name": "Spa booking"}
        """);

    evaluate("spa_booking", "T-424242", true, "STATUS");
    evaluate("never_created", basicTenant, false, "FLAG_MISSING");
  }

  @Test
  void shouldUpdateAndDeleteFlag() throws Exception {
    createFlag("""
        {"key": "late_checkout", "name": "Late checkout"}
        """);

    mockMvc
        .perform(
            put("/internal/feature-flags/late_checkout")
                .header("X-API-KEY", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Late checkout", "status": "disabled"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("disabled"));

    evaluate("late_checkout", basicTenant, false, "FLAG_DISABLED");

    mockMvc
        .perform(delete("/internal/feature-flags/late_checkout").header("X-API-KEY", API_KEY))
        .andExpect(status().isNoContent());

    mockMvc
        .perform(get("/internal/feature-flags/late_checkout").header("X-API-KEY", API_KEY))
        .andExpect(status().isNotFound());
  }

  private void createFlag(String body) throws Exception {
    mockMvc
        .perform(
            post("/internal/feature-flags")
                .header("X-API-KEY", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
        .andExpect(status().isCreated());
  }

  private void evaluate(String key, String tenant, boolean enabled, String rule) throws Exception {
    mockMvc
        .perform(
            get("/internal/feature-flags/" + key + "/evaluate")
                .header("X-API-KEY", API_KEY)
                .param("tenant", tenant))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.enabled").value(enabled))
        .andExpect(jsonPath("$.rule").value(rule));
  }
}
