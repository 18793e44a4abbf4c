package com.gentoro.mcsguide.http.filter;

import com.gentoro.mcsguide.exception.UnauthorizedException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Shared-secret check: a request is authorized when its credential header equals one of the keys
 * configured at startup. Comparison is constant-time per key. The key set never changes.
 */
public final class ApiKeyAuthenticator {
  public static final String DEFAULT_HEADER = "X-API-Key";

  private final String headerName;
  private final List<byte[]> keys;

  public ApiKeyAuthenticator(String headerName, Set<String> keys) {
    this.headerName = headerName == null || headerName.isBlank() ? DEFAULT_HEADER : headerName;
    this.keys =
        keys.stream()
            .filter(k -> k != null && !k.isBlank())
            .map(k -> k.trim().getBytes(StandardCharsets.UTF_8))
            .toList();
  }

  /** Parses a comma separated key list such as the {@code API_KEYS} environment variable. */
  public static ApiKeyAuthenticator fromKeyList(String headerName, String commaSeparatedKeys) {
    Set<String> keys = new LinkedHashSet<>();
    if (commaSeparatedKeys != null) {
      Arrays.stream(commaSeparatedKeys.split(","))
          .map(String::trim)
          .filter(k -> !k.isEmpty())
          .forEach(keys::add);
    }
    return new ApiKeyAuthenticator(headerName, keys);
  }

  public String headerName() {
    return headerName;
  }

  public int keyCount() {
    return keys.size();
  }

  public boolean isAuthorized(String presented) {
    if (presented == null || presented.isEmpty()) return false;
    byte[] candidate = presented.getBytes(StandardCharsets.UTF_8);
    boolean match = false;
    for (byte[] key : keys) {
      match |= MessageDigest.isEqual(key, candidate);
    }
    return match;
  }

  /**
   * @throws UnauthorizedException when the presented secret is missing or unknown
   */
  public void authenticate(String presented) {
    if (!isAuthorized(presented)) {
      throw new UnauthorizedException("Invalid or missing API key");
    }
  }
}
