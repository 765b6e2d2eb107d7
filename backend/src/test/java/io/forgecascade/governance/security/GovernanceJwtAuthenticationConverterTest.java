package io.forgecascade.governance.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;

class GovernanceJwtAuthenticationConverterTest {

  private final GovernanceJwtAuthenticationConverter converter =
      new GovernanceJwtAuthenticationConverter();

  private static Jwt.Builder token() {
    return Jwt.withTokenValue("token")
        .header("alg", "RS256")
        .subject("3f1c9a56-2b0e-4d8e-9a51-0c2f4b7d9e10")
        .issuedAt(Instant.parse("2026-01-01T00:00:00Z"))
        .expiresAt(Instant.parse("2026-01-01T01:00:00Z"));
  }

  @Test
  void convert_knownRole_mapsToRoleAuthority() {
    var authentication = converter.convert(token().claim("role", "trusted").build());

    assertThat(authentication.getAuthorities())
        .extracting(GrantedAuthority::getAuthority)
        .containsExactly("ROLE_TRUSTED");
    assertThat(authentication.getName()).isEqualTo("3f1c9a56-2b0e-4d8e-9a51-0c2f4b7d9e10");
  }

  @Test
  void convert_unknownRole_grantsNothing() {
    var authentication = converter.convert(token().claim("role", "superuser").build());

    assertThat(authentication.getAuthorities()).isEmpty();
  }

  @Test
  void convert_missingRole_grantsNothing() {
    var authentication = converter.convert(token().build());

    assertThat(authentication.getAuthorities()).isEmpty();
  }
}
