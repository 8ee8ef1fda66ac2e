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

package com.rackspace.minerva.app.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.Map;
import lombok.Data;
import lombok.ToString;

/**
 * A configured data source. Owned by the data source repository, only read here.
 */
@Data
public class DataSource {
  long id;
  String uid;
  long orgId;
  String name;
  String type;
  String access;
  String url;
  String user;
  String database;
  boolean basicAuth;
  String basicAuthUser;
  Map<String, Object> jsonData;

  /**
   * Encrypted secrets keyed by setting name.
   */
  @JsonIgnore
  @ToString.Exclude
  Map<String, byte[]> secureJsonData;

  Instant updated;
}
