package io.github.koe.sak.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.koe.sak.event.AktorRolle;
import io.github.koe.sak.event.EventParser;
import io.github.koe.sak.event.EventType;
import io.github.koe.sak.event.ResponsResultat;
import io.github.koe.sak.event.SakEvent;
import io.github.koe.sak.event.VederlagsMetode;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/** Client payloads and parsed events for tests. */
public final class Hendelser {
  public static final String SAK_ID = "KOE-2025-001";
  public static final Instant NOW = Instant.parse("2025-03-01T10:15:30Z");

  public static final EventParser PARSER =
      new EventParser(Clock.fixed(NOW, ZoneOffset.UTC), UUID::randomUUID);

  private static final ObjectMapper MAPPER = EventParser.createObjectMapper();

  private Hendelser() {
    // Cannot be instantiated from the outside
  }

  public static ObjectNode payload(String sakId, EventType type, AktorRolle rolle) {
    final ObjectNode payload = MAPPER.createObjectNode();
    payload.put(EventParser.SAK_ID, sakId);
    payload.put(EventParser.EVENT_TYPE, type.value());
    payload.put(EventParser.AKTOR, rolle == AktorRolle.TE ? "Tove Entreprenør" : "Bjørn Byggherre");
    payload.put(EventParser.AKTOR_ROLLE, rolle.name());
    payload.putObject(EventParser.DATA);
    return payload;
  }

  public static ObjectNode data(ObjectNode payload) {
    return (ObjectNode) payload.get(EventParser.DATA);
  }

  public static ObjectNode sakOpprettet(String sakId) {
    final ObjectNode payload = payload(sakId, EventType.SAK_OPPRETTET, AktorRolle.TE);
    data(payload).put("sakstittel", "Endret fundamentering");
    return payload;
  }

  public static ObjectNode eoSakOpprettet(String sakId) {
    final ObjectNode payload = payload(sakId, EventType.SAK_OPPRETTET, AktorRolle.BH);
    data(payload).put("sakstittel", "Endringsordre 1").put("sakstype", "ENDRINGSORDRE");
    return payload;
  }

  public static ObjectNode grunnlagOpprettet(String sakId) {
    final ObjectNode payload = payload(sakId, EventType.GRUNNLAG_OPPRETTET, AktorRolle.TE);
    data(payload)
        .put("tittel", "Uforutsette grunnforhold")
        .put("hovedkategori", "ENDRING")
        .put("underkategori", "GRUNNFORHOLD")
        .put("beskrivelse", "Fjell i dybde 2 m der det var forutsatt leire")
        .put("dato_oppdaget", "2025-02-20")
        .putArray("kontraktsreferanser")
        .add("NS 8407 §23.1");
    return payload;
  }

  public static ObjectNode grunnlagOppdatert(String sakId, String tittel) {
    final ObjectNode payload = payload(sakId, EventType.GRUNNLAG_OPPDATERT, AktorRolle.TE);
    data(payload).put("tittel", tittel);
    return payload;
  }

  public static ObjectNode vederlag(String sakId, EventType type, long belop) {
    final ObjectNode payload = payload(sakId, type, AktorRolle.TE);
    data(payload)
        .put("metode", VederlagsMetode.ENHETSPRISER.name())
        .put("belop_direkte", belop)
        .put("begrunnelse", "Merarbeid med pigging");
    return payload;
  }

  public static ObjectNode frist(String sakId, EventType type, int dager) {
    final ObjectNode payload = payload(sakId, type, AktorRolle.TE);
    data(payload).put("varsel_type", "SPESIFISERT").put("antall_dager", dager);
    return payload;
  }

  public static ObjectNode trukket(String sakId, EventType type) {
    final ObjectNode payload = payload(sakId, type, AktorRolle.TE);
    data(payload).put("begrunnelse", "Forholdet er avklart på byggemøte");
    return payload;
  }

  public static ObjectNode respons(String sakId, EventType type, ResponsResultat resultat) {
    final ObjectNode payload = payload(sakId, type, AktorRolle.BH);
    data(payload).put("resultat", resultat.name()).put("begrunnelse", "Vurdert av BH");
    return payload;
  }

  public static ObjectNode vederlagRespons(
      String sakId, EventType type, ResponsResultat resultat, long godkjent) {
    final ObjectNode payload = respons(sakId, type, resultat);
    data(payload).put("godkjent_belop", godkjent);
    return payload;
  }

  public static ObjectNode eoOpprettet(String sakId, String eoNummer) {
    final ObjectNode payload = payload(sakId, EventType.EO_OPPRETTET, AktorRolle.BH);
    data(payload).put("eo_nummer", eoNummer).put("beskrivelse", "Samlet endringsordre");
    return payload;
  }

  public static ObjectNode eoKoe(String sakId, EventType type, String koeSakId) {
    final ObjectNode payload = payload(sakId, type, AktorRolle.BH);
    data(payload).put("koe_sak_id", koeSakId);
    return payload;
  }

  public static ObjectNode eoUtstedt(String sakId, long kompensasjon, long fradrag) {
    final ObjectNode payload = payload(sakId, EventType.EO_UTSTEDT, AktorRolle.BH);
    data(payload)
        .put("kompensasjon_belop", kompensasjon)
        .put("fradrag_belop", fradrag)
        .put("frist_dager", 10);
    return payload;
  }

  public static ObjectNode eoSvar(String sakId, EventType type) {
    final ObjectNode payload = payload(sakId, type, AktorRolle.TE);
    data(payload).put("kommentar", "Svar fra TE");
    return payload;
  }

  public static ObjectNode eoRevidert(String sakId, long kompensasjon) {
    final ObjectNode payload = payload(sakId, EventType.EO_REVIDERT, AktorRolle.BH);
    data(payload).put("kompensasjon_belop", kompensasjon);
    return payload;
  }

  public static SakEvent event(ObjectNode payload) {
    return PARSER.parseCandidate(payload);
  }

  public static List<SakEvent> events(ObjectNode... payloads) {
    return Arrays.stream(payloads).map(Hendelser::event).toList();
  }

  /**
   * @return a case with grunnlag, vederlag and frist sent by TE
   */
  public static List<SakEvent> standardSak(String sakId) {
    return events(
        sakOpprettet(sakId),
        grunnlagOpprettet(sakId),
        vederlag(sakId, EventType.VEDERLAG_KRAV_SENDT, 150_000),
        frist(sakId, EventType.FRIST_KRAV_SENDT, 14));
  }
}
