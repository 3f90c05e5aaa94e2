package com.ospicorp.tsdb.security;

import com.ospicorp.tsdb.config.TsdbProperties;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component("adminAuthorization")
public class AdminAuthorization {
  private final String adminKey;

  public AdminAuthorization(TsdbProperties properties) {
    this.adminKey = properties.security().adminKey();
  }

  public boolean enabled() {
    return StringUtils.hasText(adminKey);
  }

  public boolean isAdmin(String presentedKey) {
    return enabled() && presentedKey != null && matches(adminKey, presentedKey);
  }

  public void requireAdmin(String presentedKey) {
    if (!enabled()) {
      return;
    }
    if (!StringUtils.hasText(presentedKey)) {
      throw new AuthenticationCredentialsNotFoundException("Admin key required");
    }
    if (!isAdmin(presentedKey)) {
      throw new AccessDeniedException("Invalid admin key");
    }
  }

  static boolean matches(String expected, String presented) {
    return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
        presented.getBytes(StandardCharsets.UTF_8));
  }
}
