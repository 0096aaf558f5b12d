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
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * State of the legal basis track.
 *
 * @param status of the track
 * @param tittel latest claimed title
 * @param hovedkategori latest claimed main category
 * @param underkategori latest claimed sub category
 * @param beskrivelse latest claimed description
 * @param datoOppdaget when TE discovered the circumstance
 * @param kontraktsreferanser contract clauses TE refers to
 * @param bhResultat latest BH response
 * @param bhBegrunnelse justification of the latest BH response
 * @param laast once {@code true}, the basis can no longer be changed or answered
 * @param bhRespondertVersjon zero-based claim revision BH last answered
 * @param sisteEventId latest event affecting the track
 * @param sisteOppdatert timestamp of that event
 * @param antallVersjoner number of claim revisions TE has sent
 */
public record GrunnlagTilstand(
    SporStatus status,
    String tittel,
    String hovedkategori,
    String underkategori,
    String beskrivelse,
    LocalDate datoOppdaget,
    List<String> kontraktsreferanser,
    ResponsResultat bhResultat,
    String bhBegrunnelse,
    boolean laast,
    int bhRespondertVersjon,
    UUID sisteEventId,
    Instant sisteOppdatert,
    int antallVersjoner) {
  public GrunnlagTilstand {
    kontraktsreferanser =
        kontraktsreferanser == null ? List.of() : List.copyOf(kontraktsreferanser);
  }

  static final class Builder {
    SporStatus status = SporStatus.IKKE_RELEVANT;
    String tittel;
    String hovedkategori;
    String underkategori;
    String beskrivelse;
    LocalDate datoOppdaget;
    List<String> kontraktsreferanser = List.of();
    ResponsResultat bhResultat;
    String bhBegrunnelse;
    boolean laast;
    int bhRespondertVersjon;
    UUID sisteEventId;
    Instant sisteOppdatert;
    int antallVersjoner;

    GrunnlagTilstand build() {
      return new GrunnlagTilstand(
          status,
          tittel,
          hovedkategori,
          underkategori,
          beskrivelse,
          datoOppdaget,
          kontraktsreferanser,
          bhResultat,
          bhBegrunnelse,
          laast,
          bhRespondertVersjon,
          sisteEventId,
          sisteOppdatert,
          antallVersjoner);
    }
  }
}
