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

import static com.rackspace.minerva.app.utils.DataSourceAdapters.toInstanceSettings;
import static com.rackspace.minerva.app.utils.DataSourceAdapters.toPluginUser;

import com.rackspace.minerva.app.exceptions.DataSourceAccessDeniedException;
import com.rackspace.minerva.app.exceptions.UrlNotAllowedException;
import com.rackspace.minerva.app.model.DataSource;
import com.rackspace.minerva.app.model.ParsedQuery;
import com.rackspace.minerva.app.model.ParsedRequest;
import com.rackspace.minerva.app.model.PluginContext;
import com.rackspace.minerva.app.model.QueryDataRequest;
import com.rackspace.minerva.app.model.QueryDataResponse;
import com.rackspace.minerva.app.model.SignedInUser;
import com.rackspace.minerva.app.validation.PluginRequestValidator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Sends a single data source batch straight to the backend plugin of that data source.
 */
@Service
@Slf4j
public class PluginDispatcher {

  private final PluginRequestValidator pluginRequestValidator;
  private final SecretsService secretsService;
  private final OAuthTokenService oAuthTokenService;
  private final PluginClient pluginClient;
  private final Counter decryptFailures;

  @Autowired
  public PluginDispatcher(PluginRequestValidator pluginRequestValidator,
                          SecretsService secretsService,
                          OAuthTokenService oAuthTokenService,
                          PluginClient pluginClient,
                          MeterRegistry meterRegistry) {
    this.pluginRequestValidator = pluginRequestValidator;
    this.secretsService = secretsService;
    this.oAuthTokenService = oAuthTokenService;
    this.pluginClient = pluginClient;
    this.decryptFailures = meterRegistry.counter("minerva.query.errors", "type", "decrypt");
  }

  /**
   * The data source of the first query backs the whole batch. The URL check happens before
   * any secret is decrypted or any request is sent.
   */
  public Mono<QueryDataResponse> dispatch(SignedInUser user, ParsedRequest parsedRequest) {
    return Mono.defer(() -> {
      final DataSource ds = parsedRequest.getParsedQueries().get(0).getDatasource().getDataSource();
      try {
        pluginRequestValidator.validate(ds.getUrl(), null);
      } catch (UrlNotAllowedException e) {
        return Mono.error(new DataSourceAccessDeniedException(e));
      }

      return decryptSecureJsonData(ds)
          .map(decrypted -> buildRequest(user, ds, decrypted, parsedRequest))
          .flatMap(request -> attachOAuthToken(user, ds, request))
          .flatMap(pluginClient::queryData);
    });
  }

  /**
   * A data source whose secrets cannot be decrypted is still queried, without credentials.
   * Backends that need them report an authentication error for the affected queries.
   */
  private Mono<Map<String, String>> decryptSecureJsonData(DataSource ds) {
    final Map<String, byte[]> secureJsonData =
        ds.getSecureJsonData() == null ? Map.of() : ds.getSecureJsonData();
    return secretsService.decryptJsonData(secureJsonData)
        .onErrorResume(e -> {
          log.error("Failed to decrypt secure json data for data source {}", ds.getUid(), e);
          decryptFailures.increment();
          return Mono.just(Map.of());
        });
  }

  private QueryDataRequest buildRequest(SignedInUser user, DataSource ds,
                                        Map<String, String> decrypted,
                                        ParsedRequest parsedRequest) {
    final QueryDataRequest request = new QueryDataRequest()
        .setPluginContext(new PluginContext()
            .setOrgId(ds.getOrgId())
            .setPluginId(ds.getType())
            .setUser(toPluginUser(user))
            .setDataSourceInstanceSettings(toInstanceSettings(ds, decrypted)));
    for (ParsedQuery parsedQuery : parsedRequest.getParsedQueries()) {
      request.getQueries().add(parsedQuery.getQuery());
    }
    return request;
  }

  private Mono<QueryDataRequest> attachOAuthToken(SignedInUser user, DataSource ds,
                                                  QueryDataRequest request) {
    if (!oAuthTokenService.isOAuthPassThruEnabled(ds)) {
      return Mono.just(request);
    }
    return oAuthTokenService.getCurrentOAuthToken(user)
        .map(token -> {
          request.getHeaders().put(HttpHeaders.AUTHORIZATION,
              String.format("%s %s", token.type(), token.getAccessToken()));
          return request;
        })
        .defaultIfEmpty(request);
  }
}
