package io.b2mash.payables.tds;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TdsControllerIntegrationTest {

  @Autowired private MockMvc mockMvc;

  @Test
  void calculate_roundUpOnSubCentProduct_ceilsToNextUnit() throws Exception {
    mockMvc
        .perform(
            get("/api/tds/calculate")
                .param("amount", "100.01")
                .param("percentage", "10")
                .param("roundUp", "true")
                .with(memberJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.exactWithheldAmount").value(10.0))
        .andExpect(jsonPath("$.withheldAmount").value(11.0))
        .andExpect(jsonPath("$.payableAmount").value(89.01))
        .andExpect(jsonPath("$.roundingDifference").value(1.0))
        .andExpect(jsonPath("$.roundingMakesDifference").value(true))
        .andExpect(jsonPath("$.effectivePercentage").value(11.0));
  }

  @Test
  void calculate_wholeWithholding_reportsNoRoundingDifference() throws Exception {
    mockMvc
        .perform(
            get("/api/tds/calculate")
                .param("amount", "10000")
                .param("percentage", "10")
                .param("roundUp", "true")
                .with(memberJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.withheldAmount").value(1000.0))
        .andExpect(jsonPath("$.payableAmount").value(9000.0))
        .andExpect(jsonPath("$.roundingMakesDifference").value(false))
        .andExpect(jsonPath("$.effectivePercentage").value(10.0));
  }

  @Test
  void calculate_withoutPercentage_withholdsNothing() throws Exception {
    mockMvc
        .perform(get("/api/tds/calculate").param("amount", "250.50").with(memberJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.withheldAmount").value(0.0))
        .andExpect(jsonPath("$.payableAmount").value(250.5))
        .andExpect(jsonPath("$.roundingMakesDifference").value(false));
  }

  // --- Validation ---

  @Test
  void calculate_amountWithThreeDecimals_returns400() throws Exception {
    mockMvc
        .perform(
            get("/api/tds/calculate")
                .param("amount", "100.005")
                .param("percentage", "10")
                .with(memberJwt()))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid amount"));
  }

  @Test
  void calculate_trailingZerosBeyondCents_areAccepted() throws Exception {
    mockMvc
        .perform(
            get("/api/tds/calculate")
                .param("amount", "100.100")
                .param("percentage", "10")
                .with(memberJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.withheldAmount").value(10.01));
  }

  @Test
  void calculate_percentageAboveHundred_returns400() throws Exception {
    mockMvc
        .perform(
            get("/api/tds/calculate")
                .param("amount", "100")
                .param("percentage", "100.5")
                .with(memberJwt()))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid TDS percentage"));
  }

  private JwtRequestPostProcessor memberJwt() {
    return jwt()
        .jwt(j -> j.subject("user_tds_member").claim("name", "TDS Member"))
        .authorities(new SimpleGrantedAuthority("ROLE_MEMBER"));
  }
}
