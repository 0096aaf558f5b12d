package io.github.koe.sak.state;

import static io.github.koe.sak.test.Hendelser.PARSER;
import static io.github.koe.sak.test.Hendelser.SAK_ID;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.koe.sak.event.AktorRolle;
import io.github.koe.sak.event.EventType;
import io.github.koe.sak.event.ResponsResultat;
import io.github.koe.sak.event.SakEvent;
import io.github.koe.sak.event.SaksType;
import io.github.koe.sak.event.Spor;
import io.github.koe.sak.test.Hendelser;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class StateProjectorTest {
  static final StateProjector PROJECTOR = new StateProjector();

  static List<SakEvent> standardSakMed(SakEvent... more) {
    final List<SakEvent> events = new ArrayList<>(Hendelser.standardSak(SAK_ID));
    events.addAll(Arrays.asList(more));
    return events;
  }

  static SakEvent respons(EventType type, ResponsResultat resultat) {
    return Hendelser.event(Hendelser.respons(SAK_ID, type, resultat));
  }

  @Test
  void when_events_are_null_it_throws_an_exception() {
    assertThrows(IllegalArgumentException.class, () -> PROJECTOR.project(null));
    assertThrows(
        IllegalArgumentException.class, () -> PROJECTOR.project(Arrays.asList((SakEvent) null)));
  }

  @Test
  void when_log_is_empty_nothing_is_active() {
    final var state = PROJECTOR.project(List.of());

    assertAll(
        () -> assertEquals(SporStatus.IKKE_RELEVANT, state.grunnlag().status()),
        () -> assertEquals(SporStatus.IKKE_RELEVANT, state.vederlag().status()),
        () -> assertEquals(SporStatus.IKKE_RELEVANT, state.frist().status()),
        () -> assertEquals(OverordnetStatus.INGEN_AKTIVE_SPOR, state.overordnetStatus()),
        () -> assertNull(state.endringsordre()),
        () -> assertEquals(0, state.antallEvents()),
        () -> assertEquals(BigDecimal.ZERO, state.sumKrevd()));
  }

  @Test
  void when_same_log_is_projected_twice_states_are_equal() throws Exception {
    final var events =
        standardSakMed(
            respons(EventType.RESPONS_GRUNNLAG, ResponsResultat.GODKJENT),
            Hendelser.event(
                Hendelser.vederlagRespons(
                    SAK_ID, EventType.RESPONS_VEDERLAG, ResponsResultat.DELVIS_GODKJENT, 90_000)));

    final var first = PROJECTOR.project(events);
    final var second = PROJECTOR.project(List.copyOf(events));

    assertEquals(first, second);
    assertEquals(
        PARSER.objectMapper().writeValueAsString(first),
        PARSER.objectMapper().writeValueAsString(second));
  }

  @Nested
  class StandardCaseTest {
    @Test
    void when_case_is_created_grunnlag_becomes_a_draft() {
      final var state = PROJECTOR.project(Hendelser.events(Hendelser.sakOpprettet(SAK_ID)));

      assertAll(
          () -> assertEquals(SAK_ID, state.sakId()),
          () -> assertEquals("Endret fundamentering", state.sakstittel()),
          () -> assertEquals(SaksType.STANDARD, state.sakstype()),
          () -> assertEquals(SporStatus.UTKAST, state.grunnlag().status()),
          () -> assertEquals(SporStatus.IKKE_RELEVANT, state.vederlag().status()),
          () -> assertEquals(OverordnetStatus.UTKAST, state.overordnetStatus()),
          () -> assertEquals(AktorRolle.TE, state.nesteHandling().rolle()),
          () -> assertEquals(Spor.GRUNNLAG, state.nesteHandling().spor()));
    }

    @Test
    void when_all_claims_are_sent_case_waits_for_the_client() {
      final var events = Hendelser.standardSak(SAK_ID);
      final var state = PROJECTOR.project(events);

      assertAll(
          () -> assertEquals(SporStatus.SENDT, state.grunnlag().status()),
          () -> assertEquals("Uforutsette grunnforhold", state.grunnlag().tittel()),
          () -> assertEquals(SporStatus.SENDT, state.vederlag().status()),
          () -> assertEquals(new BigDecimal("150000"), state.vederlag().krevdBelop()),
          () -> assertEquals(SporStatus.SENDT, state.frist().status()),
          () -> assertEquals(14, state.frist().krevdDager()),
          () -> assertEquals(OverordnetStatus.VENTER_PAA_SVAR, state.overordnetStatus()),
          () -> assertEquals(AktorRolle.BH, state.nesteHandling().rolle()),
          () -> assertEquals("Vurder grunnlag", state.nesteHandling().handling()),
          () -> assertEquals(new BigDecimal("150000"), state.sumKrevd()),
          () -> assertEquals(4, state.antallEvents()),
          () -> assertEquals(events.get(0).tidsstempel(), state.opprettet()),
          () -> assertEquals(events.get(3).eventId(), state.frist().sisteEventId()));
    }

    @Test
    void when_grunnlag_is_approved_it_is_locked() {
      final var state =
          PROJECTOR.project(
              standardSakMed(respons(EventType.RESPONS_GRUNNLAG, ResponsResultat.GODKJENT)));

      assertEquals(SporStatus.GODKJENT, state.grunnlag().status());
      assertTrue(state.grunnlag().laast());
      assertEquals(ResponsResultat.GODKJENT, state.grunnlag().bhResultat());
      assertEquals("Vurder vederlagskrav", state.nesteHandling().handling());
    }

    @Test
    void when_grunnlag_is_dropped_by_the_client_it_counts_as_withdrawn() {
      final var state =
          PROJECTOR.project(
              standardSakMed(respons(EventType.RESPONS_GRUNNLAG, ResponsResultat.FRAFALT)));

      assertEquals(SporStatus.TRUKKET, state.grunnlag().status());
      assertFalse(state.grunnlag().laast());
    }

    @Test
    void when_rejected_claim_is_revised_it_is_sent_again() {
      final var state =
          PROJECTOR.project(
              standardSakMed(
                  respons(EventType.RESPONS_VEDERLAG, ResponsResultat.AVSLATT),
                  Hendelser.event(
                      Hendelser.vederlag(SAK_ID, EventType.VEDERLAG_KRAV_OPPDATERT, 120_000))));

      assertAll(
          () -> assertEquals(SporStatus.SENDT, state.vederlag().status()),
          () -> assertEquals(2, state.vederlag().antallVersjoner()),
          () -> assertEquals(0, state.vederlag().bhRespondertVersjon()),
          () -> assertEquals(ResponsResultat.AVSLATT, state.vederlag().bhResultat()),
          () -> assertEquals(new BigDecimal("120000"), state.vederlag().krevdBelop()));
    }

    @Test
    void when_one_track_is_answered_the_others_are_untouched() {
      final List<SakEvent> events = new ArrayList<>(Hendelser.standardSak(SAK_ID));
      final var before = PROJECTOR.project(events);

      events.add(
          Hendelser.event(
              Hendelser.vederlagRespons(
                  SAK_ID, EventType.RESPONS_VEDERLAG, ResponsResultat.DELVIS_GODKJENT, 90_000)));
      final var after = PROJECTOR.project(events);

      assertEquals(before.grunnlag(), after.grunnlag());
      assertEquals(before.frist(), after.frist());
      assertEquals(SporStatus.DELVIS_GODKJENT, after.vederlag().status());
      assertEquals(new BigDecimal("90000"), after.sumGodkjent());
      assertEquals(OverordnetStatus.UNDER_FORHANDLING, after.overordnetStatus());
      assertEquals("Vurder grunnlag", after.nesteHandling().handling());
    }

    @Test
    void when_deadline_claim_is_specified_its_days_replace_the_notice() {
      final var state =
          PROJECTOR.project(
              standardSakMed(
                  respons(EventType.RESPONS_FRIST, ResponsResultat.UNDER_BEHANDLING),
                  Hendelser.event(
                      Hendelser.frist(SAK_ID, EventType.FRIST_KRAV_SPESIFISERT, 21))));

      assertEquals(SporStatus.SENDT, state.frist().status());
      assertEquals(21, state.frist().krevdDager());
      assertEquals(2, state.frist().antallVersjoner());
    }
  }

  @Nested
  class OverallStatusTest {
    @Test
    void when_every_active_track_is_approved_case_is_agreed_and_change_order_can_be_issued() {
      final var state =
          PROJECTOR.project(
              standardSakMed(
                  respons(EventType.RESPONS_GRUNNLAG, ResponsResultat.GODKJENT),
                  respons(EventType.RESPONS_VEDERLAG, ResponsResultat.GODKJENT),
                  respons(EventType.RESPONS_FRIST, ResponsResultat.GODKJENT)));

      assertEquals(OverordnetStatus.OMFORENT, state.overordnetStatus());
      assertTrue(state.kanUtstedeEo());
      assertEquals(NesteHandling.UTSTED_EO, state.nesteHandling());
      assertFalse(state.erLukket());
    }

    @Test
    void when_every_active_track_is_withdrawn_case_is_closed() {
      final var state =
          PROJECTOR.project(
              standardSakMed(
                  Hendelser.event(Hendelser.trukket(SAK_ID, EventType.VEDERLAG_KRAV_TRUKKET)),
                  Hendelser.event(Hendelser.trukket(SAK_ID, EventType.FRIST_KRAV_TRUKKET)),
                  Hendelser.event(Hendelser.trukket(SAK_ID, EventType.GRUNNLAG_TRUKKET))));

      assertEquals(OverordnetStatus.LUKKET_TRUKKET, state.overordnetStatus());
      assertTrue(state.erLukket());
      assertEquals(NesteHandling.INGEN, state.nesteHandling());
    }

    @Test
    void when_a_track_is_under_negotiation_it_takes_precedence_over_pending_claims() {
      final var state =
          PROJECTOR.project(
              standardSakMed(respons(EventType.RESPONS_FRIST, ResponsResultat.UNDER_FORHANDLING)));

      assertEquals(OverordnetStatus.UNDER_FORHANDLING, state.overordnetStatus());
    }

    @Test
    void when_a_track_is_being_processed_and_none_negotiated_case_is_under_processing() {
      final var state =
          PROJECTOR.project(
              standardSakMed(
                  respons(EventType.RESPONS_GRUNNLAG, ResponsResultat.UNDER_BEHANDLING)));

      assertEquals(OverordnetStatus.UNDER_BEHANDLING, state.overordnetStatus());
    }

    @Test
    void when_approved_and_withdrawn_tracks_are_mixed_status_is_unknown() {
      final var state =
          PROJECTOR.project(
              standardSakMed(
                  respons(EventType.RESPONS_GRUNNLAG, ResponsResultat.GODKJENT),
                  respons(EventType.RESPONS_VEDERLAG, ResponsResultat.GODKJENT),
                  Hendelser.event(Hendelser.trukket(SAK_ID, EventType.FRIST_KRAV_TRUKKET))));

      assertEquals(OverordnetStatus.UKJENT, state.overordnetStatus());
      assertTrue(state.kanUtstedeEo());
    }
  }

  @Nested
  class ChangeOrderTest {
    static final String EO_SAK = "EO-2025-001";

    SakEvent eo(ObjectNode payload) {
      return Hendelser.event(payload);
    }

    @Test
    void when_change_order_is_issued_on_a_standard_case_every_track_is_settled() {
      final var state =
          PROJECTOR.project(
              standardSakMed(
                  respons(EventType.RESPONS_GRUNNLAG, ResponsResultat.GODKJENT),
                  eo(Hendelser.eoUtstedt(SAK_ID, 150_000, 20_000))));

      assertAll(
          () -> assertEquals(SporStatus.LAAST, state.grunnlag().status()),
          () -> assertTrue(state.grunnlag().laast()),
          () -> assertEquals(SporStatus.GODKJENT, state.vederlag().status()),
          () -> assertEquals(SporStatus.GODKJENT, state.frist().status()),
          () -> assertTrue(state.eoUtstedt()),
          () -> assertTrue(state.erLukket()),
          () -> assertEquals(EoStatus.UTSTEDT, state.endringsordre().status()),
          () -> assertEquals(new BigDecimal("130000"), state.endringsordre().nettoBelop()),
          () -> assertEquals(OverordnetStatus.OMFORENT, state.overordnetStatus()));
    }

    @Test
    void when_change_order_case_is_created_it_has_no_claim_tracks() {
      final var state = PROJECTOR.project(List.of(eo(Hendelser.eoSakOpprettet(EO_SAK))));

      assertEquals(SaksType.ENDRINGSORDRE, state.sakstype());
      assertEquals(SporStatus.IKKE_RELEVANT, state.grunnlag().status());
      assertEquals(OverordnetStatus.INGEN_AKTIVE_SPOR, state.overordnetStatus());
    }

    @Test
    void when_change_order_runs_its_lifecycle_each_step_is_reflected() {
      final List<SakEvent> events = new ArrayList<>();
      events.add(eo(Hendelser.eoSakOpprettet(EO_SAK)));
      events.add(eo(Hendelser.eoOpprettet(EO_SAK, "EO-1")));
      events.add(eo(Hendelser.eoKoe(EO_SAK, EventType.EO_KOE_LAGT_TIL, "KOE-1")));
      events.add(eo(Hendelser.eoKoe(EO_SAK, EventType.EO_KOE_LAGT_TIL, "KOE-2")));
      events.add(eo(Hendelser.eoKoe(EO_SAK, EventType.EO_KOE_LAGT_TIL, "KOE-1")));
      events.add(eo(Hendelser.eoKoe(EO_SAK, EventType.EO_KOE_FJERNET, "KOE-2")));

      final var utkast = PROJECTOR.project(events).endringsordre();
      assertEquals(EoStatus.UTKAST, utkast.status());
      assertEquals("EO-1", utkast.eoNummer());
      assertEquals(List.of("KOE-1"), utkast.relaterteKoeSaker());

      events.add(eo(Hendelser.eoUtstedt(EO_SAK, 50_000, 0)));
      events.add(eo(Hendelser.eoSvar(EO_SAK, EventType.EO_BESTRIDT)));

      final var bestridt = PROJECTOR.project(events);
      assertEquals(EoStatus.BESTRIDT, bestridt.endringsordre().status());
      assertEquals(Boolean.FALSE, bestridt.endringsordre().teAkseptert());
      assertFalse(bestridt.eoUtstedt());
      assertFalse(bestridt.erLukket());

      events.add(eo(Hendelser.eoRevidert(EO_SAK, 65_000)));
      events.add(eo(Hendelser.eoSvar(EO_SAK, EventType.EO_AKSEPTERT)));

      final var akseptert = PROJECTOR.project(events).endringsordre();
      assertAll(
          () -> assertEquals(EoStatus.AKSEPTERT, akseptert.status()),
          () -> assertEquals(1, akseptert.revisjonNummer()),
          () -> assertEquals(new BigDecimal("65000"), akseptert.nettoBelop()),
          () -> assertEquals(Boolean.TRUE, akseptert.teAkseptert()),
          () -> assertEquals("Svar fra TE", akseptert.teKommentar()));
    }
  }
}
