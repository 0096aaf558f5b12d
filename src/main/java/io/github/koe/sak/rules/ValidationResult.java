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

package io.github.koe.sak.rules;

/**
 * Verdict of {@link BusinessRuleValidator}.
 *
 * @param valid whether the candidate event may be appended
 * @param message user-facing explanation, {@code null} when valid
 * @param violatedRule first rule the candidate broke, {@code null} when valid
 */
public record ValidationResult(boolean valid, String message, Regel violatedRule) {
  private static final ValidationResult OK = new ValidationResult(true, null, null);

  public static ValidationResult ok() {
    return OK;
  }

  public static ValidationResult brudd(Regel regel, String message) {
    if (regel == null) {
      throw new IllegalArgumentException("Rule cannot be null");
    }

    return new ValidationResult(false, message, regel);
  }
}
