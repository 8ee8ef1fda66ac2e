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

package com.rackspace.minerva.app.config;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("minerva.plugins")
@Component
@Data
@Validated
public class PluginProperties {

  /**
   * Base URL of the backend serving each data source type, keyed by plugin id.
   * Queries are posted to <code>{url}/query</code>.
   */
  @NotNull
  Map<String, String> endpoints = new HashMap<>();

  @NotNull
  Duration requestTimeout = Duration.ofSeconds(30);
}
