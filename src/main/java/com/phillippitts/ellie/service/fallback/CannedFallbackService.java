package com.phillippitts.ellie.service.fallback;

import com.phillippitts.ellie.domain.AudioResponse;
import com.phillippitts.ellie.service.classify.LegalLexicon;
import com.phillippitts.ellie.service.provider.ProviderNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * {@link FallbackService} backed by fixed reply texts.
 *
 * <p>Category selection:
 * <ul>
 *   <li>an explicit category in the context wins;</li>
 *   <li>transcription failures get {@link FallbackCategory#TECHNICAL_DIFFICULTY};</li>
 *   <li>generation failures look at the transcript: greeting, legal inquiry, long question,
 *       otherwise technical difficulty ({@link FallbackCategory#SERVICE_UNAVAILABLE} when every
 *       provider was shed).</li>
 * </ul>
 * The variant within a category is picked by transcript hash, so the same input yields the same reply.
 * Inquiry and complex-question replies carry a legal disclaimer.
 */
@Service
public class CannedFallbackService implements FallbackService {

    private static final Logger LOG = LogManager.getLogger(CannedFallbackService.class);

    static final String LAST_RESORT = "I apologize, but I'm experiencing technical difficulties. "
            + "Please contact our office directly for assistance.";

    private static final Pattern GREETING = Pattern.compile("\\b(hello|hi|hey)\\b", Pattern.CASE_INSENSITIVE);
    private static final int COMPLEX_QUESTION_LENGTH = 200;

    private static final Map<FallbackCategory, List<String>> REPLIES = new EnumMap<>(FallbackCategory.class);

    static {
        REPLIES.put(FallbackCategory.GREETING, List.of(
                "Hello! I'm Ellie, your AI legal assistant. I'm here to help answer your questions about our "
                        + "legal services. How can I assist you today?",
                "Hi there! Welcome to our law firm. I'm Ellie, and I'm here to help you with information about "
                        + "our legal services. What can I help you with?",
                "Good day! I'm Ellie, your virtual legal receptionist. I'm ready to assist you with questions "
                        + "about our practice areas and services. How may I help you?"));
        REPLIES.put(FallbackCategory.GENERAL_INQUIRY, List.of(
                "I'd be happy to help you with information about our legal services. Our firm specializes in "
                        + "various practice areas, and I can connect you with the right attorney for your needs.",
                "Thank you for your inquiry. While I'm experiencing some technical difficulties, I can still "
                        + "provide general information about our legal services. What specific area of law are "
                        + "you interested in?",
                "I appreciate your question. Although I'm having some connectivity issues, I can share that our "
                        + "experienced attorneys handle a wide range of legal matters. Would you like me to "
                        + "connect you with someone from our team?"));
        REPLIES.put(FallbackCategory.TECHNICAL_DIFFICULTY, List.of(
                "I apologize, but I'm experiencing some technical difficulties right now. Please try again in a "
                        + "moment, or feel free to contact our office directly for immediate assistance.",
                "I'm currently unable to process your request due to a temporary service issue. Our team has "
                        + "been notified and is working to resolve this quickly. You can reach our office "
                        + "directly if you need immediate help.",
                "There seems to be a technical issue on our end. While we work to fix this, you can contact our "
                        + "office directly for any urgent legal questions or to schedule a consultation."));
        REPLIES.put(FallbackCategory.SERVICE_UNAVAILABLE, List.of(
                "Our AI service is temporarily unavailable, but I want to ensure you get the help you need. "
                        + "Please contact our office directly, and one of our team members will be happy to "
                        + "assist you.",
                "I'm experiencing connectivity issues with our main systems. For immediate assistance with your "
                        + "legal questions, please call our office directly or visit our website for contact "
                        + "information.",
                "While our AI systems are temporarily down, our human team is still available to help. Please "
                        + "don't hesitate to contact our office directly for any legal assistance you need."));
        REPLIES.put(FallbackCategory.LEGAL_DISCLAIMER, List.of(
                "Please note that I provide general information only and cannot give specific legal advice. For "
                        + "personalized legal guidance, I recommend speaking with one of our qualified attorneys.",
                "I want to remind you that our conversation provides general information and should not be "
                        + "considered legal advice. For specific legal matters, please consult with one of our "
                        + "licensed attorneys.",
                "This information is for general purposes only and doesn't constitute legal advice. For advice "
                        + "specific to your situation, please schedule a consultation with one of our attorneys."));
        REPLIES.put(FallbackCategory.COMPLEX_QUESTION, List.of(
                "That's an excellent question that requires the expertise of one of our attorneys. I'd be happy "
                        + "to connect you with the right legal professional who can provide you with detailed "
                        + "guidance.",
                "Your question involves complex legal considerations that are best addressed by one of our "
                        + "experienced attorneys. Would you like me to help you schedule a consultation?",
                "This is the type of important legal question that deserves the attention of one of our "
                        + "qualified attorneys. I can help arrange for you to speak with the right legal expert."));
        REPLIES.put(FallbackCategory.OFF_TOPIC, List.of(
                "I'm here to help with questions about our legal services and practice areas. Is there "
                        + "something specific about our legal services I can assist you with?",
                "I focus on providing information about our law firm's services and legal practice areas. How "
                        + "can I help you with your legal needs today?",
                "I'm designed to assist with questions about our legal services. What legal matter can I help "
                        + "you with today?"));
    }

    private final byte[] audioCue = AudioCueGenerator.chime();

    @Override
    public AudioResponse getFallbackResponse(FallbackContext context) {
        try {
            if (context == null || context.reason() == null) {
                return reply(LAST_RESORT, 0.3, null);
            }
            FallbackCategory category = selectCategory(context);
            String seed = context.transcript() != null ? context.transcript() : context.reason().name();
            String text = variant(category, seed);
            if (category == FallbackCategory.GENERAL_INQUIRY || category == FallbackCategory.COMPLEX_QUESTION) {
                text = text + ' ' + variant(FallbackCategory.LEGAL_DISCLAIMER, seed);
            }
            LOG.debug("Fallback reply: reason={}, category={}", context.reason(), category);
            return reply(text, confidenceFor(context), context);
        } catch (RuntimeException e) {
            // Selection is pure, but the contract is that callers never see an exception
            LOG.error("Fallback selection failed; using last-resort reply", e);
            return reply(LAST_RESORT, 0.3, null);
        }
    }

    @Override
    public byte[] audioCue() {
        return audioCue.clone();
    }

    FallbackCategory selectCategory(FallbackContext context) {
        if (context.category() != null) {
            return context.category();
        }
        return switch (context.reason()) {
            case TRANSCRIPTION_FAILED, SYNTHESIS_FAILED -> FallbackCategory.TECHNICAL_DIFFICULTY;
            case GENERATION_FAILED -> categoryForTranscript(context.transcript(),
                    FallbackCategory.TECHNICAL_DIFFICULTY);
            case PROVIDERS_UNAVAILABLE -> categoryForTranscript(context.transcript(),
                    FallbackCategory.SERVICE_UNAVAILABLE);
        };
    }

    private static FallbackCategory categoryForTranscript(String transcript, FallbackCategory otherwise) {
        if (transcript == null || transcript.isBlank()) {
            return otherwise;
        }
        if (GREETING.matcher(transcript).find()) {
            return FallbackCategory.GREETING;
        }
        if (LegalLexicon.isLegalQuery(transcript)) {
            return transcript.length() > COMPLEX_QUESTION_LENGTH
                    ? FallbackCategory.COMPLEX_QUESTION
                    : FallbackCategory.GENERAL_INQUIRY;
        }
        if (transcript.length() > COMPLEX_QUESTION_LENGTH) {
            return FallbackCategory.COMPLEX_QUESTION;
        }
        return otherwise;
    }

    private static String variant(FallbackCategory category, String seed) {
        List<String> options = REPLIES.get(category);
        if (options == null || options.isEmpty()) {
            return LAST_RESORT;
        }
        return options.get(Math.floorMod(seed.hashCode(), options.size()));
    }

    private static double confidenceFor(FallbackContext context) {
        if (context.category() != null) {
            return 0.7;
        }
        return context.reason() == FallbackReason.TRANSCRIPTION_FAILED ? 0.5 : 0.3;
    }

    private AudioResponse reply(String text, double confidence, FallbackContext context) {
        return new AudioResponse(text, audioCue.clone(), confidence, 0L, ProviderNames.FALLBACK,
                context != null ? context.complexity() : null, false, true,
                context != null ? context.transcript() : null);
    }
}
