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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Data sources declared in configuration. Secrets are given in plain text here and are
 * encrypted when the repository loads them.
 */
@ConfigurationProperties("minerva.provisioning")
@Component
@Data
@Validated
public class DataSourceProvisioningProperties {

  @Valid
  @NotNull
  List<ProvisionedDataSource> datasources = new ArrayList<>();

  @Data
  public static class ProvisionedDataSource {
    @Min(1)
    long id;

    @NotBlank
    String uid;

    @Min(1)
    long orgId = 1;

    String name;

    @NotBlank
    String type;

    String access = "proxy";

    String url;

    String user;

    String database;

    boolean basicAuth;

    String basicAuthUser;

    Map<String, Object> jsonData = new HashMap<>();

    @ToString.Exclude
    Map<String, String> secureJsonData = new HashMap<>();
  }
}
