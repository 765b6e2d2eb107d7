package io.forgecascade.governance.security;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

@Component
public class GovernanceJwtAuthenticationConverter
    implements Converter<Jwt, AbstractAuthenticationToken> {

  static final String ROLE_CLAIM = "role";

  private static final Set<String> KNOWN_ROLES =
      Set.of(
          Roles.QUARANTINE,
          Roles.SANDBOX,
          Roles.STANDARD,
          Roles.TRUSTED,
          Roles.CORE,
          Roles.ADMIN,
          Roles.SYSTEM);

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    Collection<GrantedAuthority> authorities = extractAuthorities(jwt);
    return new JwtAuthenticationToken(jwt, authorities, jwt.getSubject());
  }

  private Collection<GrantedAuthority> extractAuthorities(Jwt jwt) {
    String role = jwt.getClaimAsString(ROLE_CLAIM);
    if (role == null) {
      return List.of();
    }
    String normalized = role.trim().toUpperCase(Locale.ROOT);
    if (!KNOWN_ROLES.contains(normalized)) {
      return List.of();
    }
    return List.of(new SimpleGrantedAuthority("ROLE_" + normalized));
  }
}
