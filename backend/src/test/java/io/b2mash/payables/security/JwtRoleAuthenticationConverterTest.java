package io.b2mash.payables.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;

class JwtRoleAuthenticationConverterTest {

  private final JwtRoleAuthenticationConverter converter = new JwtRoleAuthenticationConverter();

  @Test
  void convert_adminRole_grantsAdminAuthority() {
    var token = converter.convert(jwt("admin"));

    assertThat(token.getName()).isEqualTo("user_123");
    assertThat(token.getAuthorities())
        .extracting(GrantedAuthority::getAuthority)
        .containsExactly(Roles.AUTHORITY_ADMIN);
  }

  @Test
  void convert_superAdminRole_grantsSuperAdminAuthority() {
    var token = converter.convert(jwt("super_admin"));

    assertThat(token.getAuthorities())
        .extracting(GrantedAuthority::getAuthority)
        .containsExactly(Roles.AUTHORITY_SUPER_ADMIN);
  }

  @Test
  void convert_unknownRole_grantsNothing() {
    assertThat(converter.convert(jwt("auditor")).getAuthorities()).isEmpty();
  }

  @Test
  void convert_missingRole_grantsNothing() {
    assertThat(converter.convert(jwt(null)).getAuthorities()).isEmpty();
  }

  private static Jwt jwt(String role) {
    var builder =
        Jwt.withTokenValue("token")
            .header("alg", "RS256")
            .subject("user_123")
            .claim("name", "Test User")
            .issuedAt(Instant.now())
            .expiresAt(Instant.now().plusSeconds(300));
    if (role != null) {
      builder.claim(JwtRoleAuthenticationConverter.ROLE_CLAIM, role);
    }
    return builder.build();
  }
}
