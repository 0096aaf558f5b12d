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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * State of a change order.
 *
 * @param eoNummer change order number
 * @param revisjonNummer zero for the first issue, increased by every revision
 * @param beskrivelse of the change
 * @param relaterteKoeSaker claim cases the change order settles, without duplicates
 * @param kompensasjonBelop compensation granted
 * @param fradragBelop deduction
 * @param nettoBelop compensation minus deduction
 * @param fristDager days of extension granted
 * @param status of the lifecycle
 * @param utstedtAv who issued the latest revision
 * @param teAkseptert TE answer, {@code null} until TE has answered the latest revision
 * @param teKommentar comment of the TE answer
 */
public record EndringsordreTilstand(
    String eoNummer,
    int revisjonNummer,
    String beskrivelse,
    List<String> relaterteKoeSaker,
    BigDecimal kompensasjonBelop,
    BigDecimal fradragBelop,
    BigDecimal nettoBelop,
    Integer fristDager,
    EoStatus status,
    String utstedtAv,
    Boolean teAkseptert,
    String teKommentar) {
  public EndringsordreTilstand {
    relaterteKoeSaker = relaterteKoeSaker == null ? List.of() : List.copyOf(relaterteKoeSaker);
  }

  static final class Builder {
    String eoNummer;
    int revisjonNummer;
    String beskrivelse;
    final List<String> relaterteKoeSaker = new ArrayList<>();
    BigDecimal kompensasjonBelop;
    BigDecimal fradragBelop;
    Integer fristDager;
    EoStatus status = EoStatus.UTKAST;
    String utstedtAv;
    Boolean teAkseptert;
    String teKommentar;

    void leggTilKoeSak(String koeSakId) {
      if (!relaterteKoeSaker.contains(koeSakId)) {
        relaterteKoeSaker.add(koeSakId);
      }
    }

    EndringsordreTilstand build() {
      final BigDecimal kompensasjon =
          kompensasjonBelop == null ? BigDecimal.ZERO : kompensasjonBelop;
      final BigDecimal fradrag = fradragBelop == null ? BigDecimal.ZERO : fradragBelop;

      return new EndringsordreTilstand(
          eoNummer,
          revisjonNummer,
          beskrivelse,
          relaterteKoeSaker,
          kompensasjonBelop,
          fradragBelop,
          kompensasjon.subtract(fradrag),
          fristDager,
          status,
          utstedtAv,
          teAkseptert,
          teKommentar);
    }
  }
}
