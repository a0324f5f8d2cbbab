package com.phillippitts.ellie.client.degradation;

import com.phillippitts.ellie.client.capture.CaptureController;
import com.phillippitts.ellie.client.capture.VoiceState;
import com.phillippitts.ellie.client.playback.AudioPlayer;
import com.phillippitts.ellie.client.transport.ConnectionState;
import com.phillippitts.ellie.client.transport.EventType;
import com.phillippitts.ellie.client.transport.SessionTransport;
import com.phillippitts.ellie.client.transport.TransportEvent;
import com.phillippitts.ellie.client.transport.Unsubscribe;
import com.phillippitts.ellie.domain.AudioInput;
import com.phillippitts.ellie.domain.Message;
import com.phillippitts.ellie.domain.MessageMetadata;
import com.phillippitts.ellie.exception.CaptureException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Client entry point that keeps the user talking to the assistant when voice breaks.
 *
 * <p>In VOICE mode push-to-talk goes through the {@link CaptureController} and the
 * {@link SessionTransport}. An unrecoverable fault switches to TEXT mode instead of surfacing:
 * <ul>
 *   <li>a capture error that is not recoverable (permission denied, unsupported)</li>
 *   <li>the transport giving up reconnecting</li>
 *   <li>{@code maxVoiceFailures} voice faults in a row</li>
 * </ul>
 * The {@link ConversationHistory} survives the switch. Voice comes back only through
 * {@link #restoreVoice()}.
 */
public class DegradationSupervisor {

    private static final Logger LOG = LogManager.getLogger(DegradationSupervisor.class);

    private final CaptureController capture;
    private final SessionTransport transport;
    private final TextChannel textChannel;
    private final AudioPlayer player;
    private final ConversationHistory history;
    private final int maxVoiceFailures;
    private final Duration responseTimeout;

    private final AtomicReference<InteractionMode> mode = new AtomicReference<>(InteractionMode.VOICE);
    private final AtomicInteger voiceFailures = new AtomicInteger();
    private final List<ModeListener> listeners = new CopyOnWriteArrayList<>();
    private final String fallbackSessionId = "text-" + UUID.randomUUID();
    private final Unsubscribe reconnectFailed;

    public DegradationSupervisor(CaptureController capture,
                                 SessionTransport transport,
                                 TextChannel textChannel,
                                 AudioPlayer player,
                                 ConversationHistory history,
                                 int maxVoiceFailures,
                                 Duration responseTimeout) {
        this.capture = Objects.requireNonNull(capture, "capture");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.textChannel = Objects.requireNonNull(textChannel, "textChannel");
        this.player = Objects.requireNonNull(player, "player");
        this.history = Objects.requireNonNull(history, "history");
        this.maxVoiceFailures = maxVoiceFailures;
        this.responseTimeout = Objects.requireNonNull(responseTimeout, "responseTimeout");
        this.reconnectFailed = transport.on(EventType.RECONNECT_FAILED, e -> degrade("connection to server lost"));
    }

    /** Connects the transport. A connection that never comes up degrades to text. */
    public CompletableFuture<Void> start() {
        return transport.connect().exceptionally(error -> {
            LOG.warn("Voice server unreachable: {}", error.toString());
            degrade("voice server unreachable");
            return null;
        });
    }

    public InteractionMode mode() {
        return mode.get();
    }

    public ConversationHistory history() {
        return history;
    }

    public void addListener(ModeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Starts recording. A user pressing talk after a failed turn counts as the retry.
     *
     * @return true when the microphone is recording
     */
    public boolean startTalking() {
        if (mode.get() != InteractionMode.VOICE) {
            return false;
        }
        if (capture.currentState() == VoiceState.ERROR) {
            capture.retry();
        }
        try {
            capture.startCapture();
            return true;
        } catch (CaptureException e) {
            if (!e.getCaptureError().isRecoverable()) {
                degrade("microphone " + e.getCaptureError().name().toLowerCase(Locale.ROOT));
            } else {
                voiceFault("microphone " + e.getCaptureError().name().toLowerCase(Locale.ROOT));
            }
            return false;
        } catch (IllegalStateException e) {
            LOG.debug("Talk ignored in state {}", capture.currentState());
            return false;
        }
    }

    /**
     * Stops recording and sends the utterance.
     *
     * @return completes with the reply text, or empty when nothing was sent or the turn failed;
     *         never completes exceptionally
     */
    public CompletableFuture<Optional<String>> stopTalking() {
        Optional<AudioInput> utterance = capture.stopCapture();
        if (utterance.isEmpty()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        AudioInput audio = utterance.get();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("audio", Base64.getEncoder().encodeToString(audio.data()));
        payload.put("format", audio.format());
        payload.put("durationMs", audio.durationMs());
        return transport.request(EventType.VOICE_INPUT, payload, responseTimeout)
                .handle((event, error) -> {
                    if (error != null) {
                        capture.fail("transport: " + error.getMessage());
                        voiceFault("transport failure");
                        return Optional.<String>empty();
                    }
                    return onTerminal(event);
                });
    }

    private Optional<String> onTerminal(TransportEvent event) {
        if (event.type() == EventType.ERROR) {
            capture.fail(event.text("code"));
            return Optional.empty();
        }
        voiceFailures.set(0);
        String text = Optional.ofNullable(event.text("text")).orElse("");
        String transcript = event.text("transcript");
        if (transcript != null && !transcript.isBlank()) {
            history.add(Message.user(transcript));
        }
        history.add(Message.assistant(text, null, new MessageMetadata(
                event.data().path("confidence").asDouble(0.0),
                event.data().path("processingTime").asLong(0L),
                event.text("provider"))));
        byte[] audio = decode(event.text("audioBuffer"));
        if (audio.length > 0 && capture.onResponseAudio()) {
            player.play(audio).whenComplete((ok, playError) -> capture.onPlaybackComplete());
        } else {
            capture.onPlaybackComplete();
        }
        return Optional.of(text);
    }

    /**
     * Sends a typed message. Works in both modes.
     *
     * @return the assistant's reply
     */
    public String submitText(String message) {
        history.add(Message.user(message));
        TextChannel.Reply reply = textChannel.send(sessionId(), message);
        history.add(Message.assistant(reply.response(), null,
                new MessageMetadata(null, reply.processingTimeMs(), null)));
        return reply.response();
    }

    /** Leaves TEXT mode. Reconnects the transport if it gave up. */
    public void restoreVoice() {
        voiceFailures.set(0);
        if (capture.currentState() == VoiceState.ERROR) {
            capture.retry();
        }
        ConnectionState connection = transport.status().state();
        if (connection == ConnectionState.FAILED || connection == ConnectionState.DISCONNECTED) {
            transport.forceReconnect();
        }
        if (mode.compareAndSet(InteractionMode.TEXT, InteractionMode.VOICE)) {
            LOG.info("Voice mode restored");
            notifyListeners(InteractionMode.TEXT, InteractionMode.VOICE, "restored by user");
        }
    }

    public void shutdown() {
        reconnectFailed.unsubscribe();
        player.stop();
        capture.shutdown();
    }

    String sessionId() {
        String assigned = transport.sessionId();
        return assigned != null ? assigned : fallbackSessionId;
    }

    private void voiceFault(String reason) {
        int failures = voiceFailures.incrementAndGet();
        LOG.warn("Voice fault {}/{}: {}", failures, maxVoiceFailures, reason);
        if (failures >= maxVoiceFailures) {
            degrade(reason + " (" + failures + " times in a row)");
        }
    }

    private void degrade(String reason) {
        if (!mode.compareAndSet(InteractionMode.VOICE, InteractionMode.TEXT)) {
            return;
        }
        LOG.warn("Switching to text mode: {}", reason);
        capture.cancel();
        player.stop();
        notifyListeners(InteractionMode.VOICE, InteractionMode.TEXT, reason);
    }

    private void notifyListeners(InteractionMode from, InteractionMode to, String reason) {
        for (ModeListener listener : listeners) {
            try {
                listener.onModeChanged(from, to, reason);
            } catch (RuntimeException e) {
                LOG.warn("Mode listener failed: {}", e.toString());
            }
        }
    }

    private static byte[] decode(String base64) {
        if (base64 == null || base64.isEmpty()) {
            return new byte[0];
        }
        try {
            return Base64.getDecoder().decode(base64);
        } catch (IllegalArgumentException e) {
            LOG.warn("Reply audio is not valid base64; playing nothing");
            return new byte[0];
        }
    }
}
