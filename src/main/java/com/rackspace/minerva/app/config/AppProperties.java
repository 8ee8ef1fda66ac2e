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
import java.time.temporal.ChronoUnit;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("minerva")
@Component
@Data
@Validated
public class AppProperties {

  /**
   * Identifies the organization of the calling user on query API calls.
   */
  @NotBlank
  String orgHeader = "X-Org-Id";

  /**
   * Carries the login of the calling user. Authentication happens upstream of this service.
   */
  @NotBlank
  String userHeader = "X-User-Login";

  @NotBlank
  String userIdHeader = "X-User-Id";

  /**
   * Carries the calling user's access token, as <code>&lt;scheme&gt; &lt;token&gt;</code> or a
   * bare token, for data sources that forward the user's identity.
   */
  @NotBlank
  String accessTokenHeader = "X-Forwarded-Access-Token";

  /**
   * When this header is set to <code>true</code> data source lookups bypass the cache.
   */
  @NotBlank
  String noCacheHeader = "X-Minerva-NoCache";

  /**
   * Upper bound for dispatching one batch, including the expression engine or plugin call.
   */
  @NotNull
  @DurationUnit(ChronoUnit.SECONDS)
  Duration queryTimeout = Duration.ofSeconds(30);

  @NotNull
  @DurationUnit(ChronoUnit.SECONDS)
  Duration dataSourceCacheTtl = Duration.ofSeconds(5);

  @Min(0)
  long dataSourceCacheSize = 1000;
}
