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

/** Kind of notice for a time extension claim, NS 8407 §33. */
public enum FristVarselType {
  /** Preliminary notice without a day count. */
  VARSEL,

  /** Specified claim with a day count. */
  SPESIFISERT,

  /** Notice and specification sent together. */
  BEGGE;

  public boolean kreverAntallDager() {
    return this != VARSEL;
  }
}
