/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.opendata.harvest.http;

import java.io.IOException;
import java.net.URI;

/**
 * Non-success HTTP response other than 429. Never retried.
 */
public class HttpStatusException extends IOException {
  private static final long serialVersionUID = 1L;

  private static final int MAX_SNIPPET = 500;

  private final int statusCode;
  private final URI uri;

  public HttpStatusException(int statusCode, URI uri, String body) {
    super("HTTP " + statusCode + " for " + uri + ": " + snippet(body));
    this.statusCode = statusCode;
    this.uri = uri;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public URI getUri() {
    return uri;
  }

  private static String snippet(String body) {
    if (body == null) {
      return "";
    }
    String trimmed = body.trim();
    return trimmed.length() > MAX_SNIPPET ? trimmed.substring(0, MAX_SNIPPET) + "..." : trimmed;
  }
}
