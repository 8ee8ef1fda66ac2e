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

import java.util.ArrayList;
import java.util.List;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("minerva.security")
@Component
@Data
@Validated
public class SecurityProperties {

  /**
   * Used to derive the key that encrypts data source secrets.
   */
  @NotBlank
  @ToString.Exclude
  String secretKey;

  /**
   * Entries of the form <code>host</code> or <code>host:port</code>. When empty, every data
   * source URL is allowed.
   */
  @NotNull
  List<String> dataSourceUrlAllowList = new ArrayList<>();
}
