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

import io.github.koe.sak.event.AktorRolle;
import io.github.koe.sak.event.Spor;
import java.util.List;
import java.util.stream.Stream;

/** Derived fields of {@link SakState}, pure functions of the three track statuses. */
final class StatusUtleder {
  private StatusUtleder() {
    // Cannot be instantiated from the outside
  }

  /** Checks run in a fixed precedence order, the first match wins. */
  static OverordnetStatus overordnetStatus(
      SporStatus grunnlag, SporStatus vederlag, SporStatus frist) {
    final List<SporStatus> aktive =
        Stream.of(grunnlag, vederlag, frist).filter(SporStatus::erAktiv).toList();

    if (aktive.isEmpty()) {
      return OverordnetStatus.INGEN_AKTIVE_SPOR;
    }

    if (aktive.stream().allMatch(SporStatus::erAvklart)) {
      return OverordnetStatus.OMFORENT;
    }

    if (aktive.stream().allMatch(status -> status == SporStatus.TRUKKET)) {
      return OverordnetStatus.LUKKET_TRUKKET;
    }

    if (aktive.stream()
        .anyMatch(
            status ->
                status == SporStatus.UNDER_FORHANDLING
                    || status == SporStatus.DELVIS_GODKJENT
                    || status == SporStatus.AVSLATT)) {
      return OverordnetStatus.UNDER_FORHANDLING;
    }

    if (aktive.contains(SporStatus.UNDER_BEHANDLING)) {
      return OverordnetStatus.UNDER_BEHANDLING;
    }

    if (aktive.contains(SporStatus.SENDT)) {
      return OverordnetStatus.VENTER_PAA_SVAR;
    }

    if (aktive.stream().allMatch(status -> status == SporStatus.UTKAST)) {
      return OverordnetStatus.UTKAST;
    }

    return OverordnetStatus.UKJENT;
  }

  static boolean kanUtstedeEo(SporStatus grunnlag, SporStatus vederlag, SporStatus frist) {
    return grunnlag.erAvklart() && erAvsluttet(vederlag) && erAvsluttet(frist);
  }

  private static boolean erAvsluttet(SporStatus status) {
    return !status.erAktiv() || status.erAvklart() || status == SporStatus.TRUKKET;
  }

  static NesteHandling nesteHandling(SporStatus grunnlag, SporStatus vederlag, SporStatus frist) {
    switch (grunnlag) {
      case UTKAST:
        return new NesteHandling(AktorRolle.TE, "Send varsel om grunnlag", Spor.GRUNNLAG);
      case SENDT:
        return new NesteHandling(AktorRolle.BH, "Vurder grunnlag", Spor.GRUNNLAG);
      case AVSLATT:
        return new NesteHandling(
            AktorRolle.TE, "Oppdater grunnlag eller trekk saken", Spor.GRUNNLAG);
      default:
        break;
    }

    switch (vederlag) {
      case UTKAST:
        return new NesteHandling(AktorRolle.TE, "Send vederlagskrav", Spor.VEDERLAG);
      case SENDT:
        return new NesteHandling(AktorRolle.BH, "Vurder vederlagskrav", Spor.VEDERLAG);
      case AVSLATT:
      case UNDER_FORHANDLING:
        return new NesteHandling(AktorRolle.TE, "Oppdater vederlagskrav", Spor.VEDERLAG);
      default:
        break;
    }

    switch (frist) {
      case UTKAST:
        return new NesteHandling(AktorRolle.TE, "Send fristkrav", Spor.FRIST);
      case SENDT:
        return new NesteHandling(AktorRolle.BH, "Vurder fristkrav", Spor.FRIST);
      case AVSLATT:
      case UNDER_FORHANDLING:
        return new NesteHandling(AktorRolle.TE, "Oppdater fristkrav", Spor.FRIST);
      default:
        break;
    }

    return kanUtstedeEo(grunnlag, vederlag, frist) ? NesteHandling.UTSTED_EO : NesteHandling.INGEN;
  }
}
