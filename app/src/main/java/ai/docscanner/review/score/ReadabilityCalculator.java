package ai.docscanner.review.score;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes {@link Readability} with heuristic syllable counting: trailing "e", "es" and "ed" are silent and every
 * other run of vowels is one syllable, with at least one per word. Words of three or more syllables count as
 * complex for Gunning Fog and SMOG.
 */
public class ReadabilityCalculator {

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+(?:['’-][\\p{L}\\p{N}]+)*");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
    private static final Pattern SILENT_ENDING = Pattern.compile("(?:es|ed|e)$");
    private static final Pattern VOWEL_GROUP = Pattern.compile("[aeiouy]+");
    private static final int COMPLEX_SYLLABLES = 3;
    private static final int SMOG_MIN_SENTENCES = 3;

    public Readability measure(String text) {
        if (text == null || text.isBlank()) {
            return Readability.NONE;
        }
        int words = 0;
        int syllables = 0;
        int complexWords = 0;
        int characters = 0;
        Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            String word = matcher.group();
            int count = syllables(word);
            words++;
            syllables += count;
            if (count >= COMPLEX_SYLLABLES) {
                complexWords++;
            }
            characters += alphanumericLength(word);
        }
        if (words == 0) {
            return Readability.NONE;
        }
        int sentences = sentenceCount(text);

        double wordsPerSentence = (double) words / sentences;
        double syllablesPerWord = (double) syllables / words;
        double fleschReadingEase = 206.835 - 1.015 * wordsPerSentence - 84.6 * syllablesPerWord;
        double gunningFog = 0.4 * (wordsPerSentence + 100d * complexWords / words);
        double smogIndex = sentences < SMOG_MIN_SENTENCES
                ? 0d
                : 1.043 * Math.sqrt(complexWords * 30d / sentences) + 3.1291;
        double automatedReadabilityIndex = 4.71 * characters / words + 0.5 * wordsPerSentence - 21.43;
        return new Readability(round(fleschReadingEase), round(gunningFog), round(smogIndex),
                round(automatedReadabilityIndex));
    }

    static int syllables(String word) {
        String stem = SILENT_ENDING.matcher(word.toLowerCase(Locale.ROOT)).replaceAll("");
        Matcher matcher = VOWEL_GROUP.matcher(stem);
        int groups = 0;
        while (matcher.find()) {
            groups++;
        }
        return Math.max(1, groups);
    }

    private static int sentenceCount(String text) {
        int count = 0;
        for (String part : SENTENCE_END.split(text)) {
            if (WORD.matcher(part).find()) {
                count++;
            }
        }
        return Math.max(1, count);
    }

    private static int alphanumericLength(String word) {
        int length = 0;
        for (int i = 0; i < word.length(); i++) {
            if (Character.isLetterOrDigit(word.charAt(i))) {
                length++;
            }
        }
        return length;
    }

    private static double round(double value) {
        return Math.round(value * 100d) / 100d;
    }
}
