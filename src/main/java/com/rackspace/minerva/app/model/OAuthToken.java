/*
 * Copyright 2022 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.minerva.app.model;

import java.time.Instant;
import lombok.Data;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

@Data
public class OAuthToken {
  @ToString.Exclude
  String accessToken;

  String tokenType;

  @ToString.Exclude
  String refreshToken;

  Instant expiry;

  /**
   * Returns the authorization scheme to use with {@link #getAccessToken()}, "Bearer" when
   * the issuer did not report one.
   */
  public String type() {
    if ("bearer".equalsIgnoreCase(tokenType)) {
      return "Bearer";
    }
    if ("mac".equalsIgnoreCase(tokenType)) {
      return "MAC";
    }
    if ("basic".equalsIgnoreCase(tokenType)) {
      return "Basic";
    }
    return StringUtils.defaultIfBlank(tokenType, "Bearer");
  }

  /**
   * Reads a token from an <code>Authorization</code> style header value, either
   * <code>&lt;scheme&gt; &lt;token&gt;</code> or a bare token. Returns null for a blank value.
   */
  public static OAuthToken fromHeaderValue(String headerValue) {
    if (StringUtils.isBlank(headerValue)) {
      return null;
    }
    final String[] parts = headerValue.trim().split("\\s+", 2);
    if (parts.length == 1) {
      return new OAuthToken().setAccessToken(parts[0]);
    }
    return new OAuthToken().setTokenType(parts[0]).setAccessToken(parts[1]);
  }

  public boolean isExpired(Instant now) {
    return expiry != null && !expiry.isAfter(now);
  }
}
