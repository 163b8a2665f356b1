package com.phillippitts.hugdimon.service.dialog;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.phillippitts.hugdimon.service.dialog.PatternSlotExtractor.INTENT_AFFIRM;
import static com.phillippitts.hugdimon.service.dialog.PatternSlotExtractor.INTENT_BOOK;
import static com.phillippitts.hugdimon.service.dialog.PatternSlotExtractor.INTENT_DENY;
import static com.phillippitts.hugdimon.service.dialog.PatternSlotExtractor.PARTY_SIZE;
import static com.phillippitts.hugdimon.service.dialog.PatternSlotExtractor.TIME;
import static org.assertj.core.api.Assertions.assertThat;

class PatternSlotExtractorTest {

    private final PatternSlotExtractor extractor = new PatternSlotExtractor();

    @Test
    void extractsPartySizeAfterPrepositionAndBookingIntent() {
        SlotExtraction result = extractor.extract("Book a table for 2 tonight", List.of(PARTY_SIZE, TIME), "en");

        assertThat(result.slots()).containsEntry(PARTY_SIZE, "2").doesNotContainKey(TIME);
        assertThat(result.intents()).contains(INTENT_BOOK);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "a table for 4 at 7pm|4|19:00",
            "una mesa para dos a las 21:30|2|21:30",
            "une table pour quatre à 20h|4|20:00",
            "einen Tisch für drei um 19 Uhr|3|19:00",
            "una taula per a cinc persones a les 21|5|21:00",
            "столик на четыре человека в 19:00|4|19:00"
    })
    void extractsPartySizeAndTimeAcrossLanguages(String input, String party, String time) {
        SlotExtraction result = extractor.extract(input, List.of(PARTY_SIZE, TIME), "xx");

        assertThat(result.slots()).containsEntry(PARTY_SIZE, party).containsEntry(TIME, time);
    }

    @Test
    void timeDigitsAreNotMistakenForPartySize() {
        SlotExtraction result = extractor.extract("at 8", List.of(PARTY_SIZE, TIME), "en");

        assertThat(result.slots()).containsEntry(TIME, "20:00").doesNotContainKey(PARTY_SIZE);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "at 8|20:00",
            "a las 9|21:00",
            "at 12|12:00",
            "at 8 in the morning|08:00",
            "um 8 Uhr|08:00",
            "à 8h|08:00",
            "at 20|20:00"
    })
    void bareHoursDefaultToEvening(String input, String time) {
        assertThat(extractor.extract(input, List.of(TIME), "xx").slots()).containsEntry(TIME, time);
    }

    @Test
    void oneAfterPrepositionIsAPartySize() {
        SlotExtraction result = extractor.extract("Book a table for one at 8pm", List.of(PARTY_SIZE, TIME), "en");

        assertThat(result.slots()).containsEntry(PARTY_SIZE, "1").containsEntry(TIME, "20:00");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "una mesa para una|1",
            "reservar para uno|1",
            "pour un, à 20h|1",
            "per una persona|1"
    })
    void singleDinerWordsAfterPrepositionCount(String input, String party) {
        assertThat(extractor.extract(input, List.of(PARTY_SIZE), "xx").slots()).containsEntry(PARTY_SIZE, party);
    }

    @Test
    void articleBeforeTableNounIsNotAPartySize() {
        assertThat(extractor.extract("je voudrais réserver pour une table", List.of(PARTY_SIZE), "fr").slots())
                .doesNotContainKey(PARTY_SIZE);
    }

    @Test
    void bareNumberCountsOnlyWhenPartySizeRequested() {
        assertThat(extractor.extract("6", List.of(PARTY_SIZE), "en").slots()).containsEntry(PARTY_SIZE, "6");
        assertThat(extractor.extract("6", List.of(TIME), "en").slots()).isEmpty();
    }

    @Test
    void articleIsNotAPartySize() {
        SlotExtraction result = extractor.extract("quiero reservar para una cena", List.of(PARTY_SIZE), "es");

        assertThat(result.slots()).doesNotContainKey(PARTY_SIZE);
        assertThat(result.intents()).contains(INTENT_BOOK);
    }

    @Test
    void rejectsImplausiblePartySizes() {
        assertThat(extractor.extract("for 99 people", List.of(PARTY_SIZE), "en").slots()).isEmpty();
    }

    @Test
    void recognisesAffirmAndDeny() {
        assertThat(extractor.extract("Yes please", List.of(), "en").intents()).containsExactly(INTENT_AFFIRM);
        assertThat(extractor.extract("Non, merci", List.of(), "fr").intents()).contains(INTENT_DENY);
    }

    @Test
    void blankInputYieldsNothing() {
        assertThat(extractor.extract("   ", List.of(PARTY_SIZE), "en")).isEqualTo(SlotExtraction.empty());
    }
}
