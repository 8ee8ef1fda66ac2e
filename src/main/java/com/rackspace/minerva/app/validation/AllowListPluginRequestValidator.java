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

package com.rackspace.minerva.app.validation;

import com.rackspace.minerva.app.config.SecurityProperties;
import com.rackspace.minerva.app.exceptions.UrlNotAllowedException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Checks data source URLs against the configured host allow list.
 */
@Component
@Slf4j
public class AllowListPluginRequestValidator implements PluginRequestValidator {

  private final SecurityProperties securityProperties;

  public AllowListPluginRequestValidator(SecurityProperties securityProperties) {
    this.securityProperties = securityProperties;
  }

  @Override
  public void validate(String url, Map<String, String> context) {
    List<String> allowList = securityProperties.getDataSourceUrlAllowList();
    // pseudo data sources have no URL and never leave the process
    if (allowList.isEmpty() || !StringUtils.hasText(url)) {
      return;
    }

    final URI uri;
    try {
      uri = new URI(url);
    } catch (URISyntaxException e) {
      throw new UrlNotAllowedException("invalid data source url: " + url);
    }
    if (uri.getHost() == null) {
      throw new UrlNotAllowedException("data source url has no host: " + url);
    }

    String host = uri.getHost().toLowerCase(Locale.ROOT);
    String hostAndPort = uri.getPort() == -1 ? host : host + ":" + uri.getPort();
    boolean allowed = allowList.stream()
        .map(entry -> entry.trim().toLowerCase(Locale.ROOT))
        .anyMatch(entry -> entry.equals(host) || entry.equals(hostAndPort));
    if (!allowed) {
      log.debug("Rejected data source url {}", url);
      throw new UrlNotAllowedException("data source url not allowed: " + url);
    }
  }
}
