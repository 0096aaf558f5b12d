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
import io.github.koe.sak.event.VederlagsMetode;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * State of the compensation track.
 *
 * <p>{@link #krevdBelop()} is the amount that counts for the claimed method: the cost estimate
 * for {@link VederlagsMetode#REGNINGSARBEID}, the direct amount otherwise.
 */
public record VederlagTilstand(
    SporStatus status,
    VederlagsMetode metode,
    BigDecimal belopDirekte,
    BigDecimal kostnadsOverslag,
    BigDecimal krevdBelop,
    String begrunnelse,
    ResponsResultat bhResultat,
    BigDecimal godkjentBelop,
    VederlagsMetode bhMetode,
    String bhBegrunnelse,
    int bhRespondertVersjon,
    UUID sisteEventId,
    Instant sisteOppdatert,
    int antallVersjoner) {

  static final class Builder {
    SporStatus status = SporStatus.IKKE_RELEVANT;
    VederlagsMetode metode;
    BigDecimal belopDirekte;
    BigDecimal kostnadsOverslag;
    String begrunnelse;
    ResponsResultat bhResultat;
    BigDecimal godkjentBelop;
    VederlagsMetode bhMetode;
    String bhBegrunnelse;
    int bhRespondertVersjon;
    UUID sisteEventId;
    Instant sisteOppdatert;
    int antallVersjoner;

    VederlagTilstand build() {
      final BigDecimal krevdBelop =
          metode == VederlagsMetode.REGNINGSARBEID ? kostnadsOverslag : belopDirekte;

      return new VederlagTilstand(
          status,
          metode,
          belopDirekte,
          kostnadsOverslag,
          krevdBelop,
          begrunnelse,
          bhResultat,
          godkjentBelop,
          bhMetode,
          bhBegrunnelse,
          bhRespondertVersjon,
          sisteEventId,
          sisteOppdatert,
          antallVersjoner);
    }
  }
}
