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

import io.github.koe.sak.event.EoKoeEvent;
import io.github.koe.sak.event.EoOpprettetEvent;
import io.github.koe.sak.event.EoRevidertData;
import io.github.koe.sak.event.EoRevidertEvent;
import io.github.koe.sak.event.EoSvarEvent;
import io.github.koe.sak.event.EoUtstedtData;
import io.github.koe.sak.event.EoUtstedtEvent;
import io.github.koe.sak.event.EventType;
import io.github.koe.sak.event.FristData;
import io.github.koe.sak.event.FristEvent;
import io.github.koe.sak.event.FristResponsEvent;
import io.github.koe.sak.event.FristVarselType;
import io.github.koe.sak.event.GrunnlagData;
import io.github.koe.sak.event.GrunnlagEvent;
import io.github.koe.sak.event.GrunnlagResponsEvent;
import io.github.koe.sak.event.ResponsResultat;
import io.github.koe.sak.event.SakEvent;
import io.github.koe.sak.event.SakOpprettetEvent;
import io.github.koe.sak.event.SaksType;
import io.github.koe.sak.event.Spor;
import io.github.koe.sak.event.TrukketEvent;
import io.github.koe.sak.event.VederlagData;
import io.github.koe.sak.event.VederlagEvent;
import io.github.koe.sak.event.VederlagResponsEvent;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Folds a case log into a {@link SakState}.
 *
 * <p>Projection is a pure function of the event list: no caches, no clock, no side effects. The
 * same list always yields an equal state, and every call folds the whole list again.
 */
public final class StateProjector {

  /**
   * @param events of one case in log order
   * @return the current state, with every track {@link SporStatus#IKKE_RELEVANT} for an empty list
   */
  public SakState project(List<? extends SakEvent> events) {
    if (events == null) {
      throw new IllegalArgumentException("Events cannot be null");
    }

    final Fold fold = new Fold();
    for (SakEvent event : events) {
      if (event == null) {
        throw new IllegalArgumentException("Event cannot be null");
      }

      fold.apply(event);
    }

    return fold.build();
  }

  /** Mutable accumulator, confined to a single {@link #project(List)} call. */
  private static final class Fold {
    private final GrunnlagTilstand.Builder grunnlag = new GrunnlagTilstand.Builder();
    private final VederlagTilstand.Builder vederlag = new VederlagTilstand.Builder();
    private final FristTilstand.Builder frist = new FristTilstand.Builder();
    private EndringsordreTilstand.Builder endringsordre;

    private String sakId;
    private String sakstittel;
    private SaksType sakstype = SaksType.STANDARD;
    private boolean eoUtstedt;
    private Instant opprettet;
    private Instant sisteAktivitet;
    private int antallEvents;

    void apply(SakEvent event) {
      if (sakId == null) {
        sakId = event.sakId();
        opprettet = event.tidsstempel();
      }

      sisteAktivitet = event.tidsstempel();
      antallEvents++;

      final Spor berort =
          switch (event.eventType()) {
            case SAK_OPPRETTET -> sakOpprettet((SakOpprettetEvent) event);
            case GRUNNLAG_OPPRETTET, GRUNNLAG_OPPDATERT -> grunnlag((GrunnlagEvent) event);
            case GRUNNLAG_TRUKKET, VEDERLAG_KRAV_TRUKKET, FRIST_KRAV_TRUKKET ->
                trukket((TrukketEvent) event);
            case VEDERLAG_KRAV_SENDT, VEDERLAG_KRAV_OPPDATERT -> vederlag((VederlagEvent) event);
            case FRIST_KRAV_SENDT, FRIST_KRAV_OPPDATERT, FRIST_KRAV_SPESIFISERT ->
                frist((FristEvent) event);
            case RESPONS_GRUNNLAG, RESPONS_GRUNNLAG_OPPDATERT ->
                grunnlagRespons((GrunnlagResponsEvent) event);
            case RESPONS_VEDERLAG, RESPONS_VEDERLAG_OPPDATERT ->
                vederlagRespons((VederlagResponsEvent) event);
            case RESPONS_FRIST, RESPONS_FRIST_OPPDATERT -> fristRespons((FristResponsEvent) event);
            case EO_OPPRETTET -> eoOpprettet((EoOpprettetEvent) event);
            case EO_KOE_LAGT_TIL, EO_KOE_FJERNET -> eoKoe((EoKoeEvent) event);
            case EO_UTSTEDT -> eoUtstedt((EoUtstedtEvent) event);
            case EO_AKSEPTERT, EO_BESTRIDT -> eoSvar((EoSvarEvent) event);
            case EO_REVIDERT -> eoRevidert((EoRevidertEvent) event);
          };

      markerOppdatert(berort, event.eventId(), event.tidsstempel());
    }

    private void markerOppdatert(Spor spor, UUID eventId, Instant tidsstempel) {
      switch (spor) {
        case GRUNNLAG -> {
          grunnlag.sisteEventId = eventId;
          grunnlag.sisteOppdatert = tidsstempel;
        }
        case VEDERLAG -> {
          vederlag.sisteEventId = eventId;
          vederlag.sisteOppdatert = tidsstempel;
        }
        case FRIST -> {
          frist.sisteEventId = eventId;
          frist.sisteOppdatert = tidsstempel;
        }
        default -> {
          // Case-level and change order events carry their own bookkeeping
        }
      }
    }

    private Spor sakOpprettet(SakOpprettetEvent event) {
      sakstittel = event.data().sakstittel();
      sakstype = event.data().sakstype();

      if (sakstype == SaksType.STANDARD && grunnlag.status == SporStatus.IKKE_RELEVANT) {
        grunnlag.status = SporStatus.UTKAST;
      }

      return Spor.SAK;
    }

    private Spor grunnlag(GrunnlagEvent event) {
      final GrunnlagData data = event.data();

      if (event.eventType() == EventType.GRUNNLAG_OPPRETTET) {
        grunnlag.status = SporStatus.SENDT;
        grunnlag.antallVersjoner = 1;
        grunnlag.tittel = data.tittel();
        grunnlag.hovedkategori = data.hovedkategori();
        grunnlag.underkategori = data.underkategori();
        grunnlag.beskrivelse = data.beskrivelse();
        grunnlag.datoOppdaget = data.datoOppdaget();
        grunnlag.kontraktsreferanser = data.kontraktsreferanser();
        return Spor.GRUNNLAG;
      }

      grunnlag.antallVersjoner++;
      if (grunnlag.status.venterPaaRevisjon()) {
        grunnlag.status = SporStatus.SENDT;
      }

      // An update only replaces what it carries
      grunnlag.tittel = valueOr(data.tittel(), grunnlag.tittel);
      grunnlag.hovedkategori = valueOr(data.hovedkategori(), grunnlag.hovedkategori);
      grunnlag.underkategori = valueOr(data.underkategori(), grunnlag.underkategori);
      grunnlag.beskrivelse = valueOr(data.beskrivelse(), grunnlag.beskrivelse);
      grunnlag.datoOppdaget = valueOr(data.datoOppdaget(), grunnlag.datoOppdaget);
      if (!data.kontraktsreferanser().isEmpty()) {
        grunnlag.kontraktsreferanser = data.kontraktsreferanser();
      }

      return Spor.GRUNNLAG;
    }

    private Spor trukket(TrukketEvent event) {
      final Spor spor = event.eventType().spor();

      switch (spor) {
        case GRUNNLAG -> grunnlag.status = SporStatus.TRUKKET;
        case VEDERLAG -> vederlag.status = SporStatus.TRUKKET;
        case FRIST -> frist.status = SporStatus.TRUKKET;
        default -> throw new IllegalStateException("Unexpected withdrawal: " + event.eventType());
      }

      return spor;
    }

    private Spor vederlag(VederlagEvent event) {
      final VederlagData data = event.data();

      if (event.eventType() == EventType.VEDERLAG_KRAV_SENDT) {
        vederlag.status = SporStatus.SENDT;
        vederlag.antallVersjoner = 1;
      } else {
        vederlag.antallVersjoner++;
        if (vederlag.status.venterPaaRevisjon()) {
          vederlag.status = SporStatus.SENDT;
        }
      }

      vederlag.metode = data.metode();
      vederlag.belopDirekte = data.belopDirekte();
      vederlag.kostnadsOverslag = data.kostnadsOverslag();
      vederlag.begrunnelse = valueOr(data.begrunnelse(), vederlag.begrunnelse);
      return Spor.VEDERLAG;
    }

    private Spor frist(FristEvent event) {
      final FristData data = event.data();

      switch (event.eventType()) {
        case FRIST_KRAV_SENDT -> {
          frist.status = SporStatus.SENDT;
          frist.antallVersjoner = 1;
          frist.varselType = data.varselType();
        }
        case FRIST_KRAV_SPESIFISERT -> {
          frist.antallVersjoner++;
          frist.varselType = valueOr(data.varselType(), FristVarselType.SPESIFISERT);
          if (frist.status.venterPaaRevisjon() || frist.status == SporStatus.UNDER_BEHANDLING) {
            frist.status = SporStatus.SENDT;
          }
        }
        default -> {
          frist.antallVersjoner++;
          frist.varselType = valueOr(data.varselType(), frist.varselType);
          if (frist.status.venterPaaRevisjon()) {
            frist.status = SporStatus.SENDT;
          }
        }
      }

      frist.krevdDager = valueOr(data.antallDager(), frist.krevdDager);
      frist.nySluttdato = valueOr(data.nySluttdato(), frist.nySluttdato);
      frist.begrunnelse = valueOr(data.begrunnelse(), frist.begrunnelse);
      return Spor.FRIST;
    }

    private Spor grunnlagRespons(GrunnlagResponsEvent event) {
      final ResponsResultat resultat = event.data().resultat();

      grunnlag.status = SporStatus.fraResultat(resultat);
      grunnlag.bhResultat = resultat;
      grunnlag.bhBegrunnelse = event.data().begrunnelse();
      grunnlag.bhRespondertVersjon = Math.max(0, grunnlag.antallVersjoner - 1);
      if (resultat == ResponsResultat.GODKJENT) {
        grunnlag.laast = true;
      }

      return Spor.GRUNNLAG;
    }

    private Spor vederlagRespons(VederlagResponsEvent event) {
      vederlag.status = SporStatus.fraResultat(event.data().resultat());
      vederlag.bhResultat = event.data().resultat();
      vederlag.godkjentBelop = event.data().godkjentBelop();
      vederlag.bhMetode = event.data().godkjentMetode();
      vederlag.bhBegrunnelse = event.data().begrunnelse();
      vederlag.bhRespondertVersjon = Math.max(0, vederlag.antallVersjoner - 1);
      return Spor.VEDERLAG;
    }

    private Spor fristRespons(FristResponsEvent event) {
      frist.status = SporStatus.fraResultat(event.data().resultat());
      frist.bhResultat = event.data().resultat();
      frist.godkjentDager = event.data().godkjentDager();
      frist.godkjentSluttdato = event.data().nySluttdato();
      frist.vilkarOppfylt = event.data().vilkarOppfylt();
      frist.bhBegrunnelse = event.data().begrunnelse();
      frist.bhRespondertVersjon = Math.max(0, frist.antallVersjoner - 1);
      return Spor.FRIST;
    }

    private Spor eoOpprettet(EoOpprettetEvent event) {
      endringsordre = new EndringsordreTilstand.Builder();
      endringsordre.eoNummer = event.data().eoNummer();
      endringsordre.beskrivelse = event.data().beskrivelse();
      event.data().relaterteKoeSaker().forEach(endringsordre::leggTilKoeSak);
      return Spor.ENDRINGSORDRE;
    }

    private Spor eoKoe(EoKoeEvent event) {
      final EndringsordreTilstand.Builder eo = endringsordre();

      if (event.eventType() == EventType.EO_KOE_LAGT_TIL) {
        eo.leggTilKoeSak(event.data().koeSakId());
      } else {
        eo.relaterteKoeSaker.remove(event.data().koeSakId());
      }

      return Spor.ENDRINGSORDRE;
    }

    private Spor eoUtstedt(EoUtstedtEvent event) {
      final EoUtstedtData data = event.data();
      final EndringsordreTilstand.Builder eo = endringsordre();

      eo.eoNummer = valueOr(data.eoNummer(), eo.eoNummer);
      eo.beskrivelse = valueOr(data.beskrivelse(), eo.beskrivelse);
      eo.kompensasjonBelop = valueOr(data.kompensasjonBelop(), eo.kompensasjonBelop);
      eo.fradragBelop = valueOr(data.fradragBelop(), eo.fradragBelop);
      eo.fristDager = valueOr(data.fristDager(), eo.fristDager);
      eo.status = EoStatus.UTSTEDT;
      eo.utstedtAv = event.aktor();
      eo.teAkseptert = null;
      eo.teKommentar = null;

      if (sakstype == SaksType.STANDARD) {
        // Issuing a change order settles every track of a standard case
        eoUtstedt = true;
        grunnlag.status = SporStatus.LAAST;
        grunnlag.laast = true;
        markerOppdatert(Spor.GRUNNLAG, event.eventId(), event.tidsstempel());

        if (vederlag.status.erAktiv() && vederlag.status != SporStatus.TRUKKET) {
          vederlag.status = SporStatus.GODKJENT;
          markerOppdatert(Spor.VEDERLAG, event.eventId(), event.tidsstempel());
        }

        if (frist.status.erAktiv() && frist.status != SporStatus.TRUKKET) {
          frist.status = SporStatus.GODKJENT;
          markerOppdatert(Spor.FRIST, event.eventId(), event.tidsstempel());
        }
      }

      return Spor.ENDRINGSORDRE;
    }

    private Spor eoSvar(EoSvarEvent event) {
      final EndringsordreTilstand.Builder eo = endringsordre();
      final boolean akseptert = event.eventType() == EventType.EO_AKSEPTERT;

      eo.status = akseptert ? EoStatus.AKSEPTERT : EoStatus.BESTRIDT;
      eo.teAkseptert = akseptert;
      eo.teKommentar = valueOr(event.data().kommentar(), event.kommentar());
      return Spor.ENDRINGSORDRE;
    }

    private Spor eoRevidert(EoRevidertEvent event) {
      final EoRevidertData data = event.data();
      final EndringsordreTilstand.Builder eo = endringsordre();

      eo.status = EoStatus.REVIDERT;
      eo.revisjonNummer = valueOr(data.revisjonNummer(), eo.revisjonNummer + 1);
      eo.beskrivelse = valueOr(data.beskrivelse(), eo.beskrivelse);
      eo.kompensasjonBelop = valueOr(data.kompensasjonBelop(), eo.kompensasjonBelop);
      eo.fradragBelop = valueOr(data.fradragBelop(), eo.fradragBelop);
      eo.fristDager = valueOr(data.fristDager(), eo.fristDager);
      eo.utstedtAv = event.aktor();
      eo.teAkseptert = null;
      eo.teKommentar = null;
      return Spor.ENDRINGSORDRE;
    }

    private EndringsordreTilstand.Builder endringsordre() {
      if (endringsordre == null) {
        endringsordre = new EndringsordreTilstand.Builder();
      }

      return endringsordre;
    }

    SakState build() {
      final SporStatus g = grunnlag.status;
      final SporStatus v = vederlag.status;
      final SporStatus f = frist.status;
      final VederlagTilstand vederlagTilstand = vederlag.build();

      return new SakState(
          sakId,
          sakstittel,
          sakstype,
          grunnlag.build(),
          vederlagTilstand,
          frist.build(),
          endringsordre == null ? null : endringsordre.build(),
          eoUtstedt,
          StatusUtleder.overordnetStatus(g, v, f),
          StatusUtleder.kanUtstedeEo(g, v, f),
          StatusUtleder.nesteHandling(g, v, f),
          valueOr(vederlagTilstand.krevdBelop(), BigDecimal.ZERO),
          valueOr(vederlagTilstand.godkjentBelop(), BigDecimal.ZERO),
          opprettet,
          sisteAktivitet,
          antallEvents);
    }

    private static <T> T valueOr(T value, T fallback) {
      return value == null ? fallback : value;
    }
  }
}
