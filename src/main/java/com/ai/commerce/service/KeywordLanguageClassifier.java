package com.ai.commerce.service;

import com.ai.commerce.conversation.LanguageResult;
import com.ai.commerce.conversation.ResponseLanguage;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword language detection for English, Swahili and Sheng. Explicit requests ("speak swahili")
 * win; otherwise word scores decide, with code-switching reported as mixed.
 */
@Service
public class KeywordLanguageClassifier {

    private static final Pattern ASK_SWAHILI = Pattern.compile(
            "\\b(speak swahili|ongea kiswahili|in swahili|kwa kiswahili)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern ASK_ENGLISH = Pattern.compile(
            "\\b(in english|speak english|kwa kiingereza|english please)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern ASK_SHENG = Pattern.compile(
            "\\b(sheng|mtaani|street language)\\b", Pattern.CASE_INSENSITIVE);

    private static final Set<String> SWAHILI = Set.of(
            "habari", "mambo", "poa", "sawa", "asante", "karibu", "nina", "nataka",
            "niko", "uko", "yuko", "tuko", "mko", "wako", "nini", "gani", "wapi",
            "lini", "namna", "jinsi", "kwa", "na", "au", "lakini", "pia", "tu",
            "kwanza", "mwisho", "sana", "kidogo", "kubwa", "ndogo", "nzuri", "mbaya");

    private static final Set<String> SHENG = Set.of(
            "niaje", "sema", "poa", "fiti", "uko", "niko", "msee", "dame", "jamaa",
            "keja", "doh", "mullah", "ngwaci", "mathree", "gari", "job", "kazi",
            "shule", "chuo", "buda", "manzi", "dem", "boy", "kichwa", "uso");

    private static final Set<String> ENGLISH = Set.of(
            "hello", "hi", "hey", "thanks", "thank", "please", "sorry", "excuse",
            "what", "where", "when", "how", "why", "who", "which", "can", "could",
            "would", "should", "will", "shall", "may", "might", "must", "need",
            "want", "like", "love", "hate", "good", "bad", "nice", "great");

    /** Explicit language request in the message, or null. */
    public ResponseLanguage explicitRequest(String message) {
        String t = StringUtils.defaultString(message);
        if (ASK_SWAHILI.matcher(t).find()) return ResponseLanguage.SW;
        if (ASK_ENGLISH.matcher(t).find()) return ResponseLanguage.EN;
        if (ASK_SHENG.matcher(t).find()) return ResponseLanguage.SHENG;
        return null;
    }

    public LanguageResult classify(String message, double confidence) {
        if (StringUtils.isBlank(message)) {
            return new LanguageResult(ResponseLanguage.EN, confidence, false);
        }
        ResponseLanguage explicit = explicitRequest(message);
        if (explicit != null) {
            return new LanguageResult(explicit, confidence, false);
        }

        Set<String> words = new HashSet<>(Arrays.asList(message.toLowerCase(Locale.ROOT).split("[^\\p{L}']+")));
        int sw = score(words, SWAHILI);
        int sheng = score(words, SHENG);
        int en = score(words, ENGLISH);
        int total = sw + sheng + en;

        ResponseLanguage detected;
        if (total >= 2 && sw > 0 && en > 0) {
            detected = ResponseLanguage.MIXED;
        } else if (total >= 2 && sheng > 0 && (sw > 0 || en > 0)) {
            detected = ResponseLanguage.MIXED;
        } else if (sheng > sw && sheng > en) {
            detected = ResponseLanguage.SHENG;
        } else if (sw > en) {
            detected = ResponseLanguage.SW;
        } else {
            detected = ResponseLanguage.EN;
        }
        return new LanguageResult(detected, confidence, false);
    }

    private static int score(Set<String> words, Set<String> vocabulary) {
        int score = 0;
        for (String word : vocabulary) {
            if (words.contains(word)) score++;
        }
        return score;
    }
}
