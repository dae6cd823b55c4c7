package com.aerodecode.decoder.phenomenon;

import java.util.Map;
import java.util.Set;

final class PhenomenonVocabulary {
    /**
     * Single two-letter codes and precomposed multi-code phrases, looked up by the whole phenomenon string.
     */
    static final Map<String, String> PHRASES = Map.ofEntries(
            Map.entry("DZ", "морось"),
            Map.entry("RA", "дождь"),
            Map.entry("SN", "снег"),
            Map.entry("SG", "снежные зёрна"),
            Map.entry("IC", "ледяные кристаллы"),
            Map.entry("PL", "ледяной дождь"),
            Map.entry("GR", "град"),
            Map.entry("GS", "мелкий град/ледяная крупа"),
            Map.entry("UP", "неизвестные осадки"),
            Map.entry("BR", "дымка"),
            Map.entry("FG", "туман"),
            Map.entry("FU", "дым"),
            Map.entry("VA", "вулканический пепел"),
            Map.entry("DU", "пыль"),
            Map.entry("SA", "песок"),
            Map.entry("HZ", "мгла"),
            Map.entry("PY", "брызги"),
            Map.entry("SQ", "шквалы"),
            Map.entry("FC", "смерч/воронка"),
            Map.entry("SS", "песчаная буря"),
            Map.entry("DS", "пыльная буря"),
            Map.entry("SNRA", "снег с дождём"),
            Map.entry("RASN", "дождь со снегом"),
            Map.entry("SNPL", "снег с ледяным дождём"),
            Map.entry("DZRA", "морось с дождём"),
            Map.entry("RADZ", "дождь с моросью"),
            Map.entry("SNDZ", "снег с моросью"),
            Map.entry("SHSN", "ливневый снег"),
            Map.entry("SHRA", "ливневый дождь"),
            Map.entry("SHGR", "ливневый град"),
            Map.entry("SHGS", "ливневая ледяная крупа"),
            Map.entry("SHPL", "ливневый ледяной дождь"),
            Map.entry("SHSNRA", "ливневый снег с дождём"),
            Map.entry("SHRASN", "ливневый дождь со снегом")
    );

    static final Map<String, String> DESCRIPTORS = Map.of(
            "MI", "местами",
            "PR", "частичный",
            "BC", "область",
            "DR", "низовой",
            "BL", "метель",
            "SH", "ливневый",
            "TS", "гроза",
            "FZ", "переохлаждённый",
            "VC", "в окрестностях"
    );

    /**
     * Nominative to instrumental, used after the connector "с".
     */
    static final Map<String, String> INSTRUMENTAL = Map.ofEntries(
            Map.entry("дождь", "дождём"),
            Map.entry("снег", "снегом"),
            Map.entry("морось", "моросью"),
            Map.entry("град", "градом"),
            Map.entry("туман", "туманом"),
            Map.entry("дымка", "дымкой"),
            Map.entry("дым", "дымом"),
            Map.entry("пыль", "пылью"),
            Map.entry("песок", "песком"),
            Map.entry("мгла", "мглой"),
            Map.entry("шквалы", "шквалами"),
            Map.entry("крупа", "крупой"),
            Map.entry("зёрна", "зёрнами"),
            Map.entry("кристаллы", "кристаллами"),
            Map.entry("ливневый", "ливневым"),
            Map.entry("ливневая", "ливневой"),
            Map.entry("ледяной", "ледяным"),
            Map.entry("ледяная", "ледяной"),
            Map.entry("ледяные", "ледяными"),
            Map.entry("снежные", "снежными"),
            Map.entry("переохлаждённый", "переохлаждённым")
    );

    /**
     * Words that start an already inflected tail of a phrase.
     */
    static final Set<String> CONNECTORS = Set.of("с", "со");

    static final String CONNECTOR = "с";
    static final String SHOWER = "SH";
    static final String THUNDERSTORM = "TS";

    private PhenomenonVocabulary() {
    }
}
