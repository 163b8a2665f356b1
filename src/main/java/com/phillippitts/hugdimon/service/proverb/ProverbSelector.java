package com.phillippitts.hugdimon.service.proverb;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Picks a proverb matching the mood of the user message.
 *
 * <p>Proverbs among the last {@code recentWindow} picks are skipped while the mood still has
 * unused ones; once every candidate was used recently the whole mood is eligible again. The
 * window is shared by all conversations.
 *
 * <p><b>Thread Safety:</b> {@link #select(double)} is synchronized.
 */
public class ProverbSelector {

    private static final Logger LOG = LogManager.getLogger(ProverbSelector.class);

    static final Proverb DEFAULT = new Proverb(-1, "Fes bé i no facis mal, que altre sermó no et cal.",
            "Do good and do no harm, for you need no other sermon.", Mood.NEUTRAL);

    private static final Map<String, String> GLOSS_LABELS = Map.of(
            "en", "Translation",
            "es", "Traducción",
            "fr", "Traduction",
            "de", "Übersetzung",
            "ru", "Перевод",
            "ca", "Traducció (EN)");

    private final List<Proverb> proverbs;
    private final int recentWindow;
    private final Random random;
    private final Deque<Integer> recent = new ArrayDeque<>();

    public ProverbSelector(List<Proverb> proverbs, int recentWindow, Random random) {
        this.proverbs = List.copyOf(Objects.requireNonNull(proverbs, "proverbs"));
        this.recentWindow = Math.max(0, recentWindow);
        this.random = Objects.requireNonNull(random, "random");
    }

    public synchronized Proverb select(double sentiment) {
        if (proverbs.isEmpty()) {
            return DEFAULT;
        }
        Mood mood = Mood.of(sentiment);
        List<Proverb> pool = proverbs.stream().filter(p -> p.mood() == mood).toList();
        if (pool.isEmpty()) {
            LOG.debug("No {} proverbs; choosing from all", mood);
            pool = proverbs;
        }
        List<Proverb> fresh = pool.stream().filter(p -> !recent.contains(p.id())).toList();
        if (fresh.isEmpty()) {
            LOG.debug("All {} {} proverb(s) used recently; reusing the pool", pool.size(), mood);
            fresh = pool;
        }
        Proverb chosen = fresh.get(random.nextInt(fresh.size()));
        remember(chosen.id());
        return chosen;
    }

    private void remember(int id) {
        if (recentWindow == 0) {
            return;
        }
        recent.addLast(id);
        while (recent.size() > recentWindow) {
            recent.removeFirst();
        }
    }

    /**
     * Label shown before the gloss. Catalan and unsupported languages get the English gloss, so
     * their label says so.
     */
    public static String glossLabel(String language) {
        return GLOSS_LABELS.getOrDefault(language, "Translation");
    }
}
