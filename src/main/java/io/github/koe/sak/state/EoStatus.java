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

package io.github.koe.sak.state;

/**
 * Lifecycle of a change order.
 *
 * <pre>
 * UTKAST -> UTSTEDT -> AKSEPTERT
 *                   -> BESTRIDT -> REVIDERT -> UTSTEDT | AKSEPTERT | BESTRIDT
 * </pre>
 */
public enum EoStatus {
  UTKAST,
  UTSTEDT,
  AKSEPTERT,
  BESTRIDT,
  REVIDERT;

  /**
   * @return {@code true} when TE may accept or dispute the change order
   */
  public boolean kanBesvares() {
    return this == UTSTEDT || this == REVIDERT;
  }

  /**
   * @return {@code true} when BH may still change which claims the change order covers
   */
  public boolean kanEndreKoeSaker() {
    return this == UTKAST || this == REVIDERT;
  }
}
