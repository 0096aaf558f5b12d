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

import io.github.koe.sak.event.FristVarselType;
import io.github.koe.sak.event.ResponsResultat;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/** State of the time extension track. */
public record FristTilstand(
    SporStatus status,
    FristVarselType varselType,
    Integer krevdDager,
    LocalDate nySluttdato,
    String begrunnelse,
    ResponsResultat bhResultat,
    Integer godkjentDager,
    LocalDate godkjentSluttdato,
    Boolean vilkarOppfylt,
    String bhBegrunnelse,
    int bhRespondertVersjon,
    UUID sisteEventId,
    Instant sisteOppdatert,
    int antallVersjoner) {

  static final class Builder {
    SporStatus status = SporStatus.IKKE_RELEVANT;
    FristVarselType varselType;
    Integer krevdDager;
    LocalDate nySluttdato;
    String begrunnelse;
    ResponsResultat bhResultat;
    Integer godkjentDager;
    LocalDate godkjentSluttdato;
    Boolean vilkarOppfylt;
    String bhBegrunnelse;
    int bhRespondertVersjon;
    UUID sisteEventId;
    Instant sisteOppdatert;
    int antallVersjoner;

    FristTilstand build() {
      return new FristTilstand(
          status,
          varselType,
          krevdDager,
          nySluttdato,
          begrunnelse,
          bhResultat,
          godkjentDager,
          godkjentSluttdato,
          vilkarOppfylt,
          bhBegrunnelse,
          bhRespondertVersjon,
          sisteEventId,
          sisteOppdatert,
          antallVersjoner);
    }
  }
}
