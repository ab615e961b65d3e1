package com.scholary.synthjobs.api;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Derives the caller half of an admission key from a request.
 *
 * <p>By default callers are keyed by the connection's remote address, which the client cannot
 * choose. The {@code X-User-Id} and {@code X-Forwarded-For} headers are honored only when {@code
 * admission.trustProxyHeaders} is on, and that setting is only safe behind an authenticating proxy
 * that strips both headers from client requests and sets them itself. Otherwise any caller could
 * rotate the header to get a fresh budget on every request.
 *
 * <p>With trusted headers an authenticated user id wins, and anonymous callers are keyed by the
 * first {@code X-Forwarded-For} hop.
 */
final class CallerIdentity {

  static final String USER_HEADER = "X-User-Id";
  static final String FORWARDED_HEADER = "X-Forwarded-For";

  private final boolean trustProxyHeaders;

  CallerIdentity(boolean trustProxyHeaders) {
    this.trustProxyHeaders = trustProxyHeaders;
  }

  String resolve(HttpServletRequest request) {
    if (trustProxyHeaders) {
      String userId = trimToNull(request.getHeader(USER_HEADER));
      if (userId != null) {
        return "user:" + userId;
      }
      String forwarded = trimToNull(request.getHeader(FORWARDED_HEADER));
      if (forwarded != null) {
        int comma = forwarded.indexOf(',');
        return "ip:" + (comma > 0 ? forwarded.substring(0, comma) : forwarded).trim();
      }
    }
    String remote = trimToNull(request.getRemoteAddr());
    return "ip:" + (remote == null ? "unknown" : remote);
  }

  private static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
