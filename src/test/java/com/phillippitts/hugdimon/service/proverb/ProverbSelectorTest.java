package com.phillippitts.hugdimon.service.proverb;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ProverbSelectorTest {

    private static final List<Proverb> CATALOG = List.of(
            new Proverb(0, "Qui matina fa farina.", "Early risers make flour.", Mood.POSITIVE),
            new Proverb(1, "A poc a poc s'arriba lluny.", "Little by little one goes far.", Mood.POSITIVE),
            new Proverb(2, "Al mal temps, bona cara.", "In bad weather, a good face.", Mood.NEGATIVE),
            new Proverb(3, "Després de la pluja surt el sol.", "After the rain comes the sun.", Mood.NEGATIVE),
            new Proverb(4, "Cada terra fa sa guerra.", "Every land wages its own war.", Mood.NEUTRAL),
            new Proverb(5, "Qui no té feina, el gat pentina.", "Who has no work combs the cat.", Mood.NEUTRAL),
            new Proverb(6, "Parlant la gent s'entén.", "By talking people understand each other.", Mood.NEUTRAL));

    @Test
    void selectsProverbMatchingTheMoodOfTheMessage() {
        ProverbSelector selector = new ProverbSelector(CATALOG, 50, new Random(7));

        for (int i = 0; i < 10; i++) {
            assertThat(selector.select(0.6).mood()).isEqualTo(Mood.POSITIVE);
            assertThat(selector.select(-0.4).mood()).isEqualTo(Mood.NEGATIVE);
            assertThat(selector.select(0.0).mood()).isEqualTo(Mood.NEUTRAL);
        }
    }

    @Test
    void doesNotRepeatWhileUnusedProverbsOfTheMoodRemain() {
        ProverbSelector selector = new ProverbSelector(CATALOG, 50, new Random(42));

        List<Integer> picks = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            picks.add(selector.select(0.0).id());
        }

        assertThat(picks).containsExactlyInAnyOrder(4, 5, 6);
    }

    @Test
    void reusesTheMoodOnceEveryCandidateWasUsedRecently() {
        ProverbSelector selector = new ProverbSelector(CATALOG, 50, new Random(1));
        selector.select(0.9);
        selector.select(0.9);

        Proverb third = selector.select(0.9);

        assertThat(third.mood()).isEqualTo(Mood.POSITIVE);
        assertThat(third.id()).isIn(0, 1);
    }

    @Test
    void windowOfOneOnlyAvoidsTheLastPick() {
        ProverbSelector selector = new ProverbSelector(CATALOG, 1, new Random(3));

        int previous = selector.select(-0.5).id();
        for (int i = 0; i < 20; i++) {
            int next = selector.select(-0.5).id();
            assertThat(next).isNotEqualTo(previous);
            previous = next;
        }
    }

    @Test
    void picksFromWholeCatalogWhenMoodHasNoProverbs() {
        List<Proverb> neutralOnly = CATALOG.stream().filter(p -> p.mood() == Mood.NEUTRAL).toList();
        ProverbSelector selector = new ProverbSelector(neutralOnly, 50, new Random(5));

        Set<Integer> ids = new HashSet<>();
        for (int i = 0; i < 3; i++) {
            ids.add(selector.select(0.8).id());
        }

        assertThat(ids).containsExactlyInAnyOrder(4, 5, 6);
    }

    @Test
    void emptyCatalogYieldsDefaultProverb() {
        ProverbSelector selector = new ProverbSelector(List.of(), 50, new Random());

        assertThat(selector.select(0.3)).isEqualTo(ProverbSelector.DEFAULT);
    }

    @ParameterizedTest
    @CsvSource({
            "en, Translation",
            "es, Traducción",
            "fr, Traduction",
            "de, Übersetzung",
            "ru, Перевод",
            "ca, Traducció (EN)",
            "it, Translation"
    })
    void glossLabelFollowsLanguage(String language, String label) {
        assertThat(ProverbSelector.glossLabel(language)).isEqualTo(label);
    }
}
