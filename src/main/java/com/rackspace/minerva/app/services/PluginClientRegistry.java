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

import com.rackspace.minerva.app.config.PluginProperties;
import com.rackspace.minerva.app.exceptions.PluginNotRegisteredException;
import com.rackspace.minerva.app.model.QueryDataRequest;
import com.rackspace.minerva.app.model.QueryDataResponse;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Routes plugin requests by plugin id. Built-in backends are beans, remote ones come from
 * <code>minerva.plugins.endpoints</code>; a configured endpoint replaces a built-in backend
 * with the same id.
 */
@Service
@Primary
@Slf4j
public class PluginClientRegistry implements PluginClient {

  private final Map<String, BackendPlugin> backends = new HashMap<>();

  @Autowired
  public PluginClientRegistry(ObjectProvider<BackendPlugin> builtIn, PluginProperties pluginProperties,
                              WebClient.Builder webClientBuilder) {
    builtIn.orderedStream().forEach(plugin -> backends.put(plugin.getPluginId(), plugin));
    pluginProperties.getEndpoints().forEach((pluginId, url) -> backends.put(pluginId,
        new HttpBackendPlugin(pluginId, url, webClientBuilder.clone(),
            pluginProperties.getRequestTimeout())));
    log.info("Registered backend plugins {}", backends.keySet());
  }

  @Override
  public Mono<QueryDataResponse> queryData(QueryDataRequest request) {
    final String pluginId = request.getPluginContext().getPluginId();
    final BackendPlugin plugin = backends.get(pluginId);
    if (plugin == null) {
      return Mono.error(new PluginNotRegisteredException(pluginId));
    }
    return plugin.queryData(request);
  }

  public Set<String> getPluginIds() {
    return Set.copyOf(backends.keySet());
  }
}
