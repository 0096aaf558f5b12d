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

import io.github.koe.sak.event.ResponsResultat;
import java.util.EnumSet;
import java.util.Set;

/** Status of one negotiation track. */
public enum SporStatus {
  IKKE_RELEVANT,
  UTKAST,
  SENDT,
  UNDER_BEHANDLING,
  GODKJENT,
  DELVIS_GODKJENT,
  AVSLATT,
  UNDER_FORHANDLING,
  TRUKKET,
  LAAST;

  private static final Set<SporStatus> AVKLART = EnumSet.of(GODKJENT, LAAST);
  private static final Set<SporStatus> TIL_REVISJON =
      EnumSet.of(AVSLATT, DELVIS_GODKJENT, UNDER_FORHANDLING);

  /**
   * @return {@code true} when the track takes part in the case
   */
  public boolean erAktiv() {
    return this != IKKE_RELEVANT;
  }

  /**
   * @return {@code true} once TE has submitted the track at least once
   */
  public boolean erSendt() {
    return this != IKKE_RELEVANT && this != UTKAST;
  }

  /**
   * @return {@code true} when both parties agree on the track
   */
  public boolean erAvklart() {
    return AVKLART.contains(this);
  }

  /**
   * @return {@code true} when a revised claim puts the track back in front of BH
   */
  public boolean venterPaaRevisjon() {
    return TIL_REVISJON.contains(this);
  }

  /**
   * @param resultat of a BH response
   * @return status a track gets from the response
   */
  public static SporStatus fraResultat(ResponsResultat resultat) {
    return switch (resultat) {
      case GODKJENT -> GODKJENT;
      case DELVIS_GODKJENT -> DELVIS_GODKJENT;
      case AVSLATT -> AVSLATT;
      case UNDER_FORHANDLING -> UNDER_FORHANDLING;
      case UNDER_BEHANDLING -> UNDER_BEHANDLING;
      case FRAFALT -> TRUKKET;
    };
  }
}
