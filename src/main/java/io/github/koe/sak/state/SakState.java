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

import io.github.koe.sak.event.SaksType;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Current state of a case, always recomputed from its log by {@link StateProjector}.
 *
 * @param sakId of the case
 * @param sakstittel title given when the case was opened
 * @param sakstype of the case
 * @param grunnlag track state
 * @param vederlag track state
 * @param frist track state
 * @param endringsordre change order data, {@code null} until a change order is drafted or issued
 * @param eoUtstedt {@code true} once a change order settled a standard case
 * @param overordnetStatus overall status derived from the three tracks
 * @param kanUtstedeEo whether BH may issue a change order
 * @param nesteHandling hint about the next step
 * @param sumKrevd compensation claimed, zero when none
 * @param sumGodkjent compensation granted, zero when none
 * @param opprettet timestamp of the first event
 * @param sisteAktivitet timestamp of the latest event
 * @param antallEvents length of the log
 */
public record SakState(
    String sakId,
    String sakstittel,
    SaksType sakstype,
    GrunnlagTilstand grunnlag,
    VederlagTilstand vederlag,
    FristTilstand frist,
    EndringsordreTilstand endringsordre,
    boolean eoUtstedt,
    OverordnetStatus overordnetStatus,
    boolean kanUtstedeEo,
    NesteHandling nesteHandling,
    BigDecimal sumKrevd,
    BigDecimal sumGodkjent,
    Instant opprettet,
    Instant sisteAktivitet,
    int antallEvents) {

  /**
   * @return {@code true} when no further claim or response may be added to the case
   */
  public boolean erLukket() {
    return overordnetStatus == OverordnetStatus.LUKKET_TRUKKET
        || (eoUtstedt && sakstype == SaksType.STANDARD);
  }
}
