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

/** Settlement method for a compensation claim, NS 8407 §34. */
public enum VederlagsMetode {
  ENHETSPRISER,
  REGNINGSARBEID,
  FASTPRIS_TILBUD;

  /**
   * @return {@code true} when the claimed amount is a fixed sum which may also be a deduction
   */
  public boolean harDirekteBelop() {
    return this != REGNINGSARBEID;
  }
}
