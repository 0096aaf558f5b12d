/*
 * Copyright 2024 Roman Khlebnov
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

package io.github.koe.sak.event;

import java.io.Serial;
import java.util.Map;
import java.util.Optional;

/**
 * Raised when a client payload is well-formed but not acceptable, e.g. it carries server-owned
 * fields or misses a value its event type requires.
 *
 * <p>The message is meant to be shown to the user verbatim. {@link #getField()} and {@link
 * #getContext()} let a client point at the offending input, for instance by listing the values an
 * enumerated field accepts under the {@link #GYLDIGE_VERDIER} key.
 */
public class EventValidationException extends RuntimeException {
  @Serial private static final long serialVersionUID = 4160273953187412075L;

  /** Context key listing the accepted values of an enumerated field, comma-separated. */
  public static final String GYLDIGE_VERDIER = "gyldige_verdier";

  private final String field;
  private final Map<String, String> context;

  public EventValidationException(String message) {
    this(message, null, Map.of());
  }

  public EventValidationException(String message, String field) {
    this(message, field, Map.of());
  }

  /**
   * @param message to show to the user
   * @param field is the snake_case path of the offending input, may be {@code null}
   * @param context with additional details, may be {@code null}
   */
  public EventValidationException(String message, String field, Map<String, String> context) {
    super(message);
    this.field = field;
    this.context = context == null ? Map.of() : Map.copyOf(context);
  }

  public EventValidationException(String message, String field, Throwable cause) {
    super(message, cause);
    this.field = field;
    this.context = Map.of();
  }

  public Optional<String> getField() {
    return Optional.ofNullable(field);
  }

  public Map<String, String> getContext() {
    return context;
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/400">400 Bad
   *     Request</a>
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 400;
  }
}
