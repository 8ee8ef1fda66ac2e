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

import com.rackspace.minerva.app.config.ExpressionProperties;
import com.rackspace.minerva.app.exceptions.QueryDispatchException;
import com.rackspace.minerva.app.model.ExpressionRequest;
import com.rackspace.minerva.app.model.QueryDataResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Calls an expression engine running as a separate service.
 */
@Service
@Slf4j
public class RemoteExpressionService implements ExpressionService {

  private final ExpressionProperties properties;
  private final WebClient webClient;

  @Autowired
  public RemoteExpressionService(ExpressionProperties properties,
                                 WebClient.Builder webClientBuilder) {
    this.properties = properties;
    this.webClient = webClientBuilder.baseUrl(properties.getUrl()).build();
  }

  @Override
  public Mono<QueryDataResponse> transformData(ExpressionRequest request) {
    if (!properties.isEnabled()) {
      return Mono.error(new QueryDispatchException("expressions are disabled"));
    }
    log.debug("Sending {} queries to expression engine", request.getQueries().size());
    return webClient.post()
        .accept(MediaType.APPLICATION_JSON)
        .contentType(MediaType.APPLICATION_JSON)
        .body(BodyInserters.fromValue(request))
        .retrieve()
        .bodyToMono(QueryDataResponse.class);
  }
}
