package com.ospicorp.tsdb.security;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.util.StringUtils;

/** Where clients put their key: the {@code X-Api-Key} header or the {@code api_key} parameter. */
public final class ApiKeys {
  public static final String HEADER = "X-Api-Key";
  public static final String PARAMETER = "api_key";

  private ApiKeys() {
  }

  public static String resolve(HttpServletRequest request) {
    String header = request.getHeader(HEADER);
    if (StringUtils.hasText(header)) {
      return header.trim();
    }
    String parameter = request.getParameter(PARAMETER);
    return StringUtils.hasText(parameter) ? parameter : null;
  }
}
