package com.phillippitts.ellie.service.classify;

import com.phillippitts.ellie.config.properties.ClassifierProperties;
import com.phillippitts.ellie.domain.ComplexityClass;
import com.phillippitts.ellie.domain.ConversationContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HeuristicComplexityClassifierTest {

    private final HeuristicComplexityClassifier classifier = new HeuristicComplexityClassifier(new ClassifierProperties());

    @ParameterizedTest
    @ValueSource(strings = {"hello", "Hi there, how are you doing today?", "thanks", "ok", "what time?"})
    void greetingsAndShortUtterancesAreSimple(String text) {
        assertThat(classifier.classify(text, ConversationContext.empty())).isEqualTo(ComplexityClass.SIMPLE);
    }

    @Test
    void proceduralLegalQuestionIsComplex() {
        String text = "What is the statute of limitations for filing a lawsuit in my jurisdiction?";
        assertThat(classifier.classify(text, ConversationContext.empty())).isEqualTo(ComplexityClass.COMPLEX);
    }

    @Test
    void legalJargonIsComplex() {
        String text = "Pursuant to the lease, what happens if my landlord sells the building?";
        assertThat(classifier.classify(text, ConversationContext.empty())).isEqualTo(ComplexityClass.COMPLEX);
    }

    @Test
    void ordinaryQuestionIsModerate() {
        String text = "Can you explain how a rental deposit works here for tenants?";
        assertThat(classifier.classify(text, ConversationContext.empty())).isEqualTo(ComplexityClass.MODERATE);
    }

    @Test
    void shortFollowUpToComplexTurnIsModerate() {
        ConversationContext afterComplex = new ConversationContext(List.of(), ComplexityClass.COMPLEX);
        assertThat(classifier.classify("and then what", afterComplex)).isEqualTo(ComplexityClass.MODERATE);
        assertThat(classifier.classify("thanks", afterComplex)).isEqualTo(ComplexityClass.SIMPLE);
    }

    @Test
    void thresholdsComeFromProperties() {
        ClassifierProperties props = new ClassifierProperties();
        props.setSimpleMaxLength(100);
        HeuristicComplexityClassifier lenient = new HeuristicComplexityClassifier(props);

        String text = "Can you explain how a rental deposit works here for tenants?";
        assertThat(lenient.classify(text, ConversationContext.empty())).isEqualTo(ComplexityClass.SIMPLE);
    }

    @Test
    void sameInputAlwaysYieldsSameClass() {
        String text = "My employer breached the agreement and I want damages for negligence.";
        ComplexityClass first = classifier.classify(text, ConversationContext.empty());
        for (int i = 0; i < 50; i++) {
            assertThat(classifier.classify(text, ConversationContext.empty())).isEqualTo(first);
        }
    }

    @Test
    void nullTranscriptIsTreatedAsEmpty() {
        assertThat(classifier.classify(null, null)).isEqualTo(ComplexityClass.SIMPLE);
    }
}
