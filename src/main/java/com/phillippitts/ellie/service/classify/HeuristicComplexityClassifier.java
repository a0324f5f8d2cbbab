package com.phillippitts.ellie.service.classify;

import com.phillippitts.ellie.config.properties.ClassifierProperties;
import com.phillippitts.ellie.domain.ComplexityClass;
import com.phillippitts.ellie.domain.ConversationContext;
import com.phillippitts.ellie.exception.ClassificationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Keyword and length heuristics for routing.
 *
 * <p>Rules, evaluated on the trimmed transcript:
 * <ul>
 *   <li><b>SIMPLE</b>: starts with a greeting or smalltalk phrase, or is shorter than
 *       {@code simple-max-length}</li>
 *   <li><b>COMPLEX</b>: contains a procedural legal indicator, legal jargon, more than one question
 *       above {@code complex-min-length}, or a legal-term density at or above
 *       {@code complex-keyword-density}</li>
 *   <li><b>MODERATE</b>: everything else</li>
 * </ul>
 *
 * <p>When both SIMPLE and COMPLEX match, SIMPLE wins unless the transcript is longer than
 * {@code complex-min-length} or its term density reaches the threshold. A short non-smalltalk
 * follow-up to a COMPLEX turn is MODERATE rather than SIMPLE.
 *
 * <p>Pure function of its inputs; no state is kept between calls.
 */
@Component
public class HeuristicComplexityClassifier implements ComplexityClassifier {

    private static final Logger LOG = LogManager.getLogger(HeuristicComplexityClassifier.class);

    private static final List<Pattern> SMALLTALK_PATTERNS = List.of(
            Pattern.compile("^(hi|hello|hey|good morning|good afternoon|good evening)"),
            Pattern.compile("^(how are you|what's your name|who are you)"),
            Pattern.compile("^(thank you|thanks|bye|goodbye)"),
            Pattern.compile("^(yes|no|okay|ok)$"),
            Pattern.compile("what (do you do|services)"));

    /** Density is meaningless on a handful of words or a single keyword. */
    private static final int MIN_WORDS_FOR_DENSITY = 5;
    private static final int MIN_TERMS_FOR_DENSITY = 2;

    private final ClassifierProperties props;

    public HeuristicComplexityClassifier(ClassifierProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public ComplexityClass classify(String transcript, ConversationContext context) {
        try {
            ComplexityClass result = doClassify(transcript == null ? "" : transcript.trim(),
                    context == null ? ConversationContext.empty() : context);
            LOG.debug("Classified transcript (chars={}) as {}", transcript == null ? 0 : transcript.length(), result);
            return result;
        } catch (RuntimeException e) {
            throw new ClassificationException("Heuristic classification failed", e);
        }
    }

    private ComplexityClass doClassify(String text, ConversationContext context) {
        String lower = text.toLowerCase(Locale.ROOT);
        int length = text.length();

        boolean smalltalk = isSmalltalk(lower);
        boolean shortText = length < props.getSimpleMaxLength();
        double density = termDensity(text);
        boolean denseOrLong = length > props.getComplexMinLength() || density >= props.getComplexKeywordDensity();

        boolean complex = LegalLexicon.hasComplexIndicator(text)
                || LegalLexicon.hasJargon(text)
                || (questionCount(text) > 1 && length > props.getComplexMinLength())
                || density >= props.getComplexKeywordDensity();

        if (smalltalk || shortText) {
            if (complex && denseOrLong) {
                return ComplexityClass.COMPLEX;
            }
            if (!smalltalk && context.previousComplexity() == ComplexityClass.COMPLEX) {
                return ComplexityClass.MODERATE;
            }
            return ComplexityClass.SIMPLE;
        }
        return complex ? ComplexityClass.COMPLEX : ComplexityClass.MODERATE;
    }

    private static boolean isSmalltalk(String lower) {
        for (Pattern p : SMALLTALK_PATTERNS) {
            if (p.matcher(lower).find()) {
                return true;
            }
        }
        return false;
    }

    private static int questionCount(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '?') {
                count++;
            }
        }
        return count;
    }

    private static double termDensity(String text) {
        if (text.isEmpty()) {
            return 0.0;
        }
        int words = text.split("\\s+").length;
        if (words < MIN_WORDS_FOR_DENSITY) {
            return 0.0;
        }
        int terms = LegalLexicon.countLegalTerms(text);
        return terms < MIN_TERMS_FOR_DENSITY ? 0.0 : (double) terms / words;
    }
}
