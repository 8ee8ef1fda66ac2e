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

import java.time.Instant;
import java.util.Map;
import lombok.Data;
import lombok.ToString;

/**
 * The materialized configuration a backend plugin needs to run queries against one data
 * source, with its secrets already decrypted.
 */
@Data
public class DataSourceInstanceSettings {
  long id;
  String uid;
  String name;
  String url;
  String user;
  String database;
  boolean basicAuthEnabled;
  String basicAuthUser;
  Map<String, Object> jsonData;

  @ToString.Exclude
  Map<String, String> decryptedSecureJsonData;

  Instant updated;
}
