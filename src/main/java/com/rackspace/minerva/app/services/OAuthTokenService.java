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

package com.rackspace.minerva.app.services;

import com.rackspace.minerva.app.model.DataSource;
import com.rackspace.minerva.app.model.OAuthToken;
import com.rackspace.minerva.app.model.SignedInUser;
import java.time.Clock;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Provides the calling user's own identity provider token for data sources configured to
 * forward it.
 */
@Service
@Slf4j
public class OAuthTokenService {

  static final String OAUTH_PASS_THRU = "oauthPassThru";

  private final OAuthTokenStore tokenStore;
  private final Clock clock;

  @Autowired
  public OAuthTokenService(OAuthTokenStore tokenStore) {
    this(tokenStore, Clock.systemUTC());
  }

  OAuthTokenService(OAuthTokenStore tokenStore, Clock clock) {
    this.tokenStore = tokenStore;
    this.clock = clock;
  }

  public boolean isOAuthPassThruEnabled(DataSource ds) {
    final Map<String, Object> jsonData = ds.getJsonData();
    if (jsonData == null) {
      return false;
    }
    final Object value = jsonData.get(OAUTH_PASS_THRU);
    return Boolean.TRUE.equals(value) || "true".equals(value);
  }

  /**
   * A token forwarded with the request replaces the one stored for the user. Otherwise the
   * stored token is used. Completes empty when the user has no token or it has expired.
   */
  public Mono<OAuthToken> getCurrentOAuthToken(SignedInUser user) {
    if (user == null) {
      return Mono.empty();
    }
    final OAuthToken forwarded = user.getForwardedToken();
    final Mono<OAuthToken> current;
    if (forwarded != null) {
      current = user.getUserId() > 0 ?
          tokenStore.save(user.getUserId(), forwarded).thenReturn(forwarded) :
          Mono.just(forwarded);
    } else {
      current = tokenStore.findByUserId(user.getUserId());
    }
    return current
        .filter(token -> {
          if (token.isExpired(clock.instant())) {
            log.debug("Ignoring expired oauth token for user {}", user.getLogin());
            return false;
          }
          return true;
        });
  }
}
