package com.phillippitts.hugdimon.service.dialog;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keyword and pattern based {@link SlotExtractor} for the booking flow.
 *
 * <p>Recognises:
 * <ul>
 *   <li>{@code time}: clock expressions such as {@code 19:00}, {@code 7pm}, {@code at 8},
 *       {@code a las 9}, {@code à 20h}, {@code um 8 Uhr}; normalised to {@code HH:mm}. A bare
 *       hour from 1 to 11 ({@code at 8}) is read as evening unless a morning word is present</li>
 *   <li>{@code party_size}: a number (digits or number word) after "for"-style prepositions or
 *       before a people word; a bare number is accepted when the step asks for it</li>
 *   <li>intents {@code book_table}, {@code affirm}, {@code deny}</li>
 * </ul>
 * Keyword lists cover en, es, fr, de, ca and ru and are matched regardless of the detected
 * language, since short replies are often misdetected.
 */
@Component
public class PatternSlotExtractor implements SlotExtractor {

    public static final String PARTY_SIZE = "party_size";
    public static final String TIME = "time";

    public static final String INTENT_BOOK = "book_table";
    public static final String INTENT_AFFIRM = "affirm";
    public static final String INTENT_DENY = "deny";

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final Pattern CLOCK = Pattern.compile("\\b([01]?\\d|2[0-3])[:.h]([0-5]\\d)\\b", FLAGS);
    private static final Pattern MERIDIEM = Pattern.compile("\\b(1[0-2]|0?[1-9])(?:[:.]([0-5]\\d))?\\s*([ap])\\.?m\\.?(?=\\W|$)", FLAGS);
    private static final Pattern AT_HOUR = Pattern.compile(
            "(?:\\bat|\\ba las|\\ba la|\\bà|\\bvers|\\bum|\\bgegen|\\ba les|\\ba la|\\bв)\\s+([01]?\\d|2[0-3])(?:\\s*(h|uhr|heures?|hores?|часов|час))?\\b",
            FLAGS);
    /** Words that pin a bare hour to the morning; otherwise "at 8" means dinner time. */
    private static final Pattern MORNING = Pattern.compile(
            "\\b(?:morning|breakfast|brunch|matin|morgens|vormittags?|утра|del matí|de la mañana)\\b", FLAGS);

    private static final Map<String, Integer> NUMBER_WORDS = numberWords();
    /** Number words that double as indefinite articles ("una mesa", "une table"). */
    private static final Set<String> ARTICLES = Set.of("un", "una", "une", "ein", "eine");
    /** Nouns that mark a preceding article as "a" rather than "one" ("para una cena"). */
    private static final Set<String> ARTICLE_NOUNS = Set.of(
            "mesa", "table", "taula", "tisch", "cena", "comida", "sopar", "dinar", "dîner", "diner",
            "déjeuner", "soirée", "noche", "nit", "reserva", "réservation", "reservierung",
            "terraza", "terrasse", "terrassa");

    private static final String NUMBER = "(\\d{1,2}|" + String.join("|", NUMBER_WORDS.keySet()) + ")";
    private static final Pattern AFTER_PREPOSITION = Pattern.compile(
            "(?:\\bfor|\\bpara|\\bpour|\\bfür|\\bfur|\\bper a|\\bper|\\bна)\\s+" + NUMBER + "\\b(?:\\s+(\\p{L}+))?",
            FLAGS);
    private static final Pattern BEFORE_PEOPLE = Pattern.compile(
            "\\b" + NUMBER + "\\s+(?:people|persons?|guests|pax|of us|personas|persones|personnes|personen|leute|gäste|человека?|гостей|гостя)\\b",
            FLAGS);
    private static final Pattern BARE_NUMBER = Pattern.compile("^\\s*" + NUMBER + "\\s*[.!]?\\s*$", FLAGS);

    private static final Set<String> BOOK_WORDS = Set.of(
            "book", "booking", "reserve", "reservation", "table",
            "reservar", "reserva", "mesa",
            "réserver", "reserver", "réservation",
            "reservieren", "reservierung", "tisch", "buchen",
            "taula", "reservo",
            "забронировать", "бронь", "столик", "бронировать");
    private static final Set<String> AFFIRM_WORDS = Set.of(
            "yes", "yeah", "yep", "sure", "ok", "okay", "confirm", "correct", "perfect",
            "sí", "si", "claro", "vale", "confirmo", "perfecto",
            "oui", "d'accord", "parfait", "confirme",
            "ja", "genau", "bestätigen", "klar",
            "perfecte", "d'acord", "confirmat",
            "да", "конечно", "подтверждаю", "хорошо");
    private static final Set<String> DENY_WORDS = Set.of(
            "no", "nope", "cancel", "wrong", "not",
            "cancelar", "incorrecto",
            "non", "annuler", "pas",
            "nein", "stornieren", "falsch",
            "cancel·lar", "cancela",
            "нет", "отмена", "отменить", "неверно");

    @Override
    public SlotExtraction extract(String input, List<String> requestedSlots, String language) {
        if (input == null || input.isBlank()) {
            return SlotExtraction.empty();
        }
        Map<String, String> slots = new LinkedHashMap<>();
        String remainder = input;

        TimeMatch time = findTime(input);
        if (time != null) {
            slots.put(TIME, time.value());
            remainder = input.substring(0, time.start()) + " " + input.substring(time.end());
        }

        Integer party = findPartySize(remainder, requestedSlots.contains(PARTY_SIZE));
        if (party != null) {
            slots.put(PARTY_SIZE, String.valueOf(party));
        }

        return new SlotExtraction(slots, findIntents(input));
    }

    private static TimeMatch findTime(String text) {
        Matcher m = MERIDIEM.matcher(text);
        if (m.find()) {
            int hour = Integer.parseInt(m.group(1)) % 12;
            if (m.group(3).equalsIgnoreCase("p")) {
                hour += 12;
            }
            int minute = m.group(2) == null ? 0 : Integer.parseInt(m.group(2));
            return new TimeMatch(format(hour, minute), m.start(), m.end());
        }
        m = CLOCK.matcher(text);
        if (m.find()) {
            return new TimeMatch(format(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2))), m.start(), m.end());
        }
        m = AT_HOUR.matcher(text);
        if (m.find()) {
            int hour = Integer.parseInt(m.group(1));
            // Bare 1..11 without a unit or morning word is an evening booking.
            if (hour >= 1 && hour <= 11 && m.group(2) == null && !MORNING.matcher(text).find()) {
                hour += 12;
            }
            return new TimeMatch(format(hour, 0), m.start(), m.end());
        }
        return null;
    }

    private static Integer findPartySize(String text, boolean bareAllowed) {
        Matcher m = BEFORE_PEOPLE.matcher(text);
        if (m.find()) {
            Integer n = toNumber(m.group(1), true);
            if (n != null) {
                return n;
            }
        }
        m = AFTER_PREPOSITION.matcher(text);
        while (m.find()) {
            String next = m.group(2) == null ? "" : m.group(2).toLowerCase(Locale.ROOT);
            Integer n = toNumber(m.group(1), !ARTICLE_NOUNS.contains(next));
            if (n != null) {
                return n;
            }
        }
        if (bareAllowed) {
            m = BARE_NUMBER.matcher(text);
            if (m.matches()) {
                return toNumber(m.group(1), true);
            }
        }
        return null;
    }

    private static Integer toNumber(String token, boolean articlesAllowed) {
        String t = token.toLowerCase(Locale.ROOT);
        Integer n;
        if (t.chars().allMatch(Character::isDigit)) {
            n = Integer.parseInt(t);
        } else {
            if (!articlesAllowed && ARTICLES.contains(t)) {
                return null;
            }
            n = NUMBER_WORDS.get(t);
        }
        return n != null && n >= 1 && n <= 50 ? n : null;
    }

    private static Set<String> findIntents(String text) {
        Set<String> tokens = Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}'·]+"))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
        Set<String> intents = new HashSet<>();
        if (tokens.stream().anyMatch(BOOK_WORDS::contains)) {
            intents.add(INTENT_BOOK);
        }
        if (tokens.stream().anyMatch(AFFIRM_WORDS::contains)) {
            intents.add(INTENT_AFFIRM);
        }
        if (tokens.stream().anyMatch(DENY_WORDS::contains)) {
            intents.add(INTENT_DENY);
        }
        return intents;
    }

    private static String format(int hour, int minute) {
        return String.format(Locale.ROOT, "%02d:%02d", hour, minute);
    }

    private static Map<String, Integer> numberWords() {
        Map<String, Integer> m = new LinkedHashMap<>();
        String[][] lists = {
                {"one", "two", "three", "four", "five", "six", "seven", "eight", "nine", "ten", "eleven", "twelve"},
                {"uno", "dos", "tres", "cuatro", "cinco", "seis", "siete", "ocho", "nueve", "diez", "once", "doce"},
                {"un", "deux", "trois", "quatre", "cinq", "six", "sept", "huit", "neuf", "dix", "onze", "douze"},
                {"ein", "zwei", "drei", "vier", "fünf", "sechs", "sieben", "acht", "neun", "zehn", "elf", "zwölf"},
                {"un", "dues", "tres", "quatre", "cinc", "sis", "set", "vuit", "nou", "deu", "onze", "dotze"},
                {"один", "два", "три", "четыре", "пять", "шесть", "семь", "восемь", "девять", "десять"},
        };
        for (String[] words : lists) {
            for (int i = 0; i < words.length; i++) {
                m.putIfAbsent(words[i], i + 1);
            }
        }
        m.put("una", 1);
        m.put("une", 1);
        m.put("eine", 1);
        m.put("двух", 2);
        m.put("троих", 3);
        m.put("четверых", 4);
        // Longest alternatives first so the regex prefers "quatre" over a shorter prefix.
        return m.entrySet().stream()
                .sorted((a, b) -> Integer.compare(b.getKey().length(), a.getKey().length()))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
    }

    private record TimeMatch(String value, int start, int end) {
    }
}
