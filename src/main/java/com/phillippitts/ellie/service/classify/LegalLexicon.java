package com.phillippitts.ellie.service.classify;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Word lists for the legal-services domain, shared by classification, routing and reply checks.
 * All matching is case-insensitive substring matching on the raw transcript.
 */
public final class LegalLexicon {

    /** Phrases that mark a multi-party or procedural legal question. */
    static final List<String> COMPLEX_INDICATORS = List.of(
            "multiple parties", "litigation", "court proceedings", "legal strategy",
            "case analysis", "precedent", "jurisdiction", "statute of limitations",
            "constitutional", "appellate", "class action", "settlement negotiation");

    /** Practice-area keywords that merit the accurate provider on longer questions. */
    static final List<String> ROUTING_KEYWORDS = List.of(
            "contract", "agreement", "liability", "damages", "negligence", "breach",
            "intellectual property", "copyright", "trademark", "patent", "employment law",
            "real estate", "estate planning", "will", "trust", "probate", "divorce",
            "custody", "criminal law", "civil rights", "constitutional law");

    /** Broad legal vocabulary; a reply to such a question should carry a disclaimer. */
    static final List<String> LEGAL_QUERY_KEYWORDS = List.of(
            "law", "legal", "attorney", "lawyer", "court", "judge", "contract",
            "agreement", "liability", "damages", "sue", "lawsuit", "rights",
            "violation", "breach", "negligence", "fraud", "criminal", "civil");

    static final List<String> DISCLAIMER_MARKERS = List.of(
            "general information", "not legal advice", "consult with an attorney",
            "professional legal advice", "qualified attorney", "legal professional");

    static final Pattern LEGAL_JARGON =
            Pattern.compile("\\b(whereas|heretofore|pursuant|notwithstanding|aforementioned)\\b",
                    Pattern.CASE_INSENSITIVE);

    /** Appended to replies to legal questions that do not already carry a disclaimer. */
    public static final String DISCLAIMER = "This is general information, not legal advice. "
            + "For your specific situation, please consult with an attorney.";

    private LegalLexicon() {
    }

    public static boolean hasRoutingKeyword(String text) {
        return containsAny(text, ROUTING_KEYWORDS);
    }

    public static boolean isLegalQuery(String text) {
        return containsAny(text, LEGAL_QUERY_KEYWORDS);
    }

    public static boolean hasDisclaimer(String reply) {
        return containsAny(reply, DISCLAIMER_MARKERS);
    }

    static boolean hasComplexIndicator(String text) {
        return containsAny(text, COMPLEX_INDICATORS);
    }

    static boolean hasJargon(String text) {
        return text != null && LEGAL_JARGON.matcher(text).find();
    }

    /**
     * Counts non-overlapping occurrences of indicator and routing terms.
     */
    static int countLegalTerms(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        int hits = 0;
        for (String term : COMPLEX_INDICATORS) {
            hits += occurrences(lower, term);
        }
        for (String term : ROUTING_KEYWORDS) {
            hits += occurrences(lower, term);
        }
        return hits;
    }

    private static int occurrences(String haystack, String needle) {
        int count = 0;
        int from = haystack.indexOf(needle);
        while (from >= 0) {
            count++;
            from = haystack.indexOf(needle, from + needle.length());
        }
        return count;
    }

    private static boolean containsAny(String text, List<String> terms) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String term : terms) {
            if (lower.contains(term)) {
                return true;
            }
        }
        return false;
    }
}
