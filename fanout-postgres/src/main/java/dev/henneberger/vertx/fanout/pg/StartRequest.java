/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.fanout.pg;

import dev.henneberger.vertx.fanout.core.OptionValidation;

public final class StartRequest {

  private final String connectionSlug;
  private final String publicationName;
  private final Long listenForMs;

  /**
   * @param listenForMs bounded run length, or {@code null} to run until stopped
   */
  public StartRequest(String connectionSlug, String publicationName, Long listenForMs) {
    OptionValidation.require("connectionSlug", connectionSlug);
    OptionValidation.require("publicationName", publicationName);
    if (listenForMs != null) {
      OptionValidation.requireMin("listenForMs", listenForMs, 1);
    }
    this.connectionSlug = connectionSlug;
    this.publicationName = publicationName;
    this.listenForMs = listenForMs;
  }

  public static StartRequest of(DataStoreBinding binding, Long listenForMs) {
    return new StartRequest(binding.connectionSlug(), binding.publicationName(), listenForMs);
  }

  public String connectionSlug() {
    return connectionSlug;
  }

  public String publicationName() {
    return publicationName;
  }

  public Long listenForMs() {
    return listenForMs;
  }
}
