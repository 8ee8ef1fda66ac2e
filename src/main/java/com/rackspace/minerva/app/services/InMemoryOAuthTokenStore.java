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

import com.rackspace.minerva.app.model.OAuthToken;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
public class InMemoryOAuthTokenStore implements OAuthTokenStore {

  private final Map<Long, OAuthToken> tokens = new ConcurrentHashMap<>();

  @Override
  public Mono<OAuthToken> findByUserId(long userId) {
    return Mono.fromSupplier(() -> tokens.get(userId));
  }

  @Override
  public Mono<Void> save(long userId, OAuthToken token) {
    return Mono.fromRunnable(() -> tokens.put(userId, token));
  }
}
