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

import com.rackspace.minerva.app.model.QueryDataRequest;
import com.rackspace.minerva.app.model.QueryDataResponse;
import java.time.Duration;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * A backend plugin running as its own service, reached over HTTP.
 */
public class HttpBackendPlugin implements BackendPlugin {

  private final String pluginId;
  private final WebClient webClient;
  private final Duration requestTimeout;

  public HttpBackendPlugin(String pluginId, String baseUrl, WebClient.Builder webClientBuilder,
                           Duration requestTimeout) {
    this.pluginId = pluginId;
    this.webClient = webClientBuilder.baseUrl(baseUrl).build();
    this.requestTimeout = requestTimeout;
  }

  @Override
  public String getPluginId() {
    return pluginId;
  }

  @Override
  public Mono<QueryDataResponse> queryData(QueryDataRequest request) {
    return webClient.post()
        .uri("/query")
        .accept(MediaType.APPLICATION_JSON)
        .contentType(MediaType.APPLICATION_JSON)
        .body(BodyInserters.fromValue(request))
        .retrieve()
        .bodyToMono(QueryDataResponse.class)
        .timeout(requestTimeout)
        .name("pluginQueryData")
        .tag("plugin", pluginId)
        .metrics();
  }
}
