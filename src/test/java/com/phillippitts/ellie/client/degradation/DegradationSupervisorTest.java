package com.phillippitts.ellie.client.degradation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phillippitts.ellie.client.capture.CaptureController;
import com.phillippitts.ellie.client.capture.VoiceState;
import com.phillippitts.ellie.client.playback.AudioPlayer;
import com.phillippitts.ellie.client.transport.ConnectionState;
import com.phillippitts.ellie.client.transport.ConnectionStatus;
import com.phillippitts.ellie.client.transport.EventType;
import com.phillippitts.ellie.client.transport.SessionTransport;
import com.phillippitts.ellie.client.transport.TransportEvent;
import com.phillippitts.ellie.client.transport.Unsubscribe;
import com.phillippitts.ellie.domain.AudioInput;
import com.phillippitts.ellie.domain.Message;
import com.phillippitts.ellie.domain.MessageRole;
import com.phillippitts.ellie.exception.CaptureError;
import com.phillippitts.ellie.exception.CaptureException;
import com.phillippitts.ellie.exception.TransportError;
import com.phillippitts.ellie.exception.TransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DegradationSupervisorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private CaptureController capture;
    private SessionTransport transport;
    private TextChannel textChannel;
    private AudioPlayer player;
    private ConversationHistory history;
    private Consumer<TransportEvent> reconnectFailedHandler;
    private final List<String> modeChanges = new ArrayList<>();
    private DegradationSupervisor supervisor;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        capture = mock(CaptureController.class);
        transport = mock(SessionTransport.class);
        textChannel = mock(TextChannel.class);
        player = mock(AudioPlayer.class);
        history = new ConversationHistory(50);
        when(capture.currentState()).thenReturn(VoiceState.IDLE);
        when(transport.on(eq(EventType.RECONNECT_FAILED), any())).thenAnswer(invocation -> {
            reconnectFailedHandler = invocation.getArgument(1, Consumer.class);
            return (Unsubscribe) () -> { };
        });
        supervisor = new DegradationSupervisor(capture, transport, textChannel, player, history, 3, TIMEOUT);
        supervisor.addListener((from, to, reason) -> modeChanges.add(from + "->" + to));
    }

    @Test
    void startsInVoiceMode() {
        assertThat(supervisor.mode()).isEqualTo(InteractionMode.VOICE);
    }

    @Test
    void deniedMicrophoneSwitchesToTextImmediately() {
        doThrow(new CaptureException(CaptureError.PERMISSION_DENIED, "denied")).when(capture).startCapture();

        assertThat(supervisor.startTalking()).isFalse();

        assertThat(supervisor.mode()).isEqualTo(InteractionMode.TEXT);
        assertThat(modeChanges).containsExactly("VOICE->TEXT");
        verify(capture).cancel();
        verify(player).stop();
    }

    @Test
    void recoverableFaultsDegradeOnlyAfterConsecutiveLimit() {
        doThrow(new CaptureException(CaptureError.DEVICE_BUSY, "busy")).when(capture).startCapture();

        supervisor.startTalking();
        supervisor.startTalking();
        assertThat(supervisor.mode()).isEqualTo(InteractionMode.VOICE);

        supervisor.startTalking();
        assertThat(supervisor.mode()).isEqualTo(InteractionMode.TEXT);
        assertThat(modeChanges).containsExactly("VOICE->TEXT");
    }

    @Test
    void talkIsIgnoredInTextMode() {
        reconnectFailedHandler.accept(new TransportEvent(EventType.RECONNECT_FAILED, null, null));

        assertThat(supervisor.startTalking()).isFalse();
        verify(capture, never()).startCapture();
    }

    @Test
    void talkAfterFailedTurnRetriesFirst() {
        when(capture.currentState()).thenReturn(VoiceState.ERROR);

        assertThat(supervisor.startTalking()).isTrue();

        var order = inOrder(capture);
        order.verify(capture).retry();
        order.verify(capture).startCapture();
    }

    @Test
    void exhaustedReconnectsSwitchToText() {
        reconnectFailedHandler.accept(new TransportEvent(EventType.RECONNECT_FAILED, null, null));

        assertThat(supervisor.mode()).isEqualTo(InteractionMode.TEXT);
        assertThat(modeChanges).containsExactly("VOICE->TEXT");
    }

    @Test
    void unreachableServerAtStartSwitchesToText() {
        when(transport.connect()).thenReturn(CompletableFuture.failedFuture(
                new TransportException(TransportError.RECONNECT_EXHAUSTED, "gave up")));

        assertThat(supervisor.start()).isCompleted();
        assertThat(supervisor.mode()).isEqualTo(InteractionMode.TEXT);
    }

    @Test
    @SuppressWarnings("unchecked")
    void voiceTurnSendsAudioAndPlaysReply() {
        byte[] recorded = {1, 2, 3, 4};
        byte[] reply = {9, 9, 9};
        when(capture.stopCapture()).thenReturn(Optional.of(new AudioInput(recorded, "wav", 1200)));
        when(capture.onResponseAudio()).thenReturn(true);
        when(player.play(any())).thenReturn(CompletableFuture.completedFuture(null));
        when(transport.request(eq(EventType.VOICE_INPUT), any(), eq(TIMEOUT)))
                .thenReturn(CompletableFuture.completedFuture(aiResponse("Sunny today", reply, "what's the weather")));

        Optional<String> text = supervisor.stopTalking().join();

        assertThat(text).contains("Sunny today");
        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(transport).request(eq(EventType.VOICE_INPUT), payload.capture(), eq(TIMEOUT));
        Map<String, Object> sent = (Map<String, Object>) payload.getValue();
        assertThat(sent).containsEntry("audio", Base64.getEncoder().encodeToString(recorded))
                .containsEntry("format", "wav")
                .containsEntry("durationMs", 1200L);
        verify(player).play(reply);
        verify(capture).onPlaybackComplete();
        assertThat(history.snapshot()).extracting(Message::role, Message::text)
                .containsExactly(tuple(MessageRole.USER, "what's the weather"),
                        tuple(MessageRole.ASSISTANT, "Sunny today"));
        assertThat(history.snapshot().get(1).metadata().provider()).isEqualTo("groq");
    }

    @Test
    void replyWithoutAudioReturnsToIdleWithoutPlayback() {
        when(capture.stopCapture()).thenReturn(Optional.of(new AudioInput(new byte[]{1}, "wav", 10)));
        when(transport.request(any(), any(), any()))
                .thenReturn(CompletableFuture.completedFuture(aiResponse("Text only", null)));

        assertThat(supervisor.stopTalking().join()).contains("Text only");

        verify(player, never()).play(any());
        verify(capture).onPlaybackComplete();
        assertThat(history.snapshot()).extracting(Message::role).containsExactly(MessageRole.ASSISTANT);
    }

    @Test
    void nothingRecordedSendsNothing() {
        when(capture.stopCapture()).thenReturn(Optional.empty());

        assertThat(supervisor.stopTalking().join()).isEmpty();
        verify(transport, never()).request(any(), any(), any());
    }

    @Test
    void serverErrorFailsTheTurnWithoutDegrading() {
        ObjectNode data = MAPPER.createObjectNode().put("code", "EXTERNAL_API_ERROR").put("message", "down");
        when(capture.stopCapture()).thenReturn(Optional.of(new AudioInput(new byte[]{1}, "wav", 10)));
        when(transport.request(any(), any(), any()))
                .thenReturn(CompletableFuture.completedFuture(new TransportEvent(EventType.ERROR, data, null)));

        assertThat(supervisor.stopTalking().join()).isEmpty();

        verify(capture).fail("EXTERNAL_API_ERROR");
        assertThat(supervisor.mode()).isEqualTo(InteractionMode.VOICE);
    }

    @Test
    void repeatedTransportFailuresDegradeAndSuccessResetsCount() {
        when(capture.stopCapture()).thenReturn(Optional.of(new AudioInput(new byte[]{1}, "wav", 10)));
        CompletableFuture<TransportEvent> timeout = CompletableFuture.failedFuture(
                new TransportException(TransportError.TIMEOUT, "no reply"));
        when(transport.request(any(), any(), any()))
                .thenReturn(timeout, timeout, CompletableFuture.completedFuture(aiResponse("ok", null)),
                        timeout, timeout);

        supervisor.stopTalking().join();
        supervisor.stopTalking().join();
        supervisor.stopTalking().join();
        supervisor.stopTalking().join();
        assertThat(supervisor.mode()).isEqualTo(InteractionMode.VOICE);

        supervisor.stopTalking().join();
        verify(capture, times(4)).fail(anyString());
        assertThat(supervisor.mode()).isEqualTo(InteractionMode.VOICE);

        supervisor.stopTalking().join();
        assertThat(supervisor.mode()).isEqualTo(InteractionMode.TEXT);
    }

    @Test
    void textTurnsShareHistoryWithVoiceTurns() {
        when(transport.sessionId()).thenReturn("sess-1");
        when(textChannel.send("sess-1", "What time is it?"))
                .thenReturn(new TextChannel.Reply("Noon", 42));

        assertThat(supervisor.submitText("What time is it?")).isEqualTo("Noon");

        assertThat(history.snapshot()).extracting(Message::role, Message::text)
                .containsExactly(
                        tuple(MessageRole.USER, "What time is it?"),
                        tuple(MessageRole.ASSISTANT, "Noon"));
    }

    @Test
    void textSessionIdIsStableWithoutServerSession() {
        assertThat(supervisor.sessionId()).startsWith("text-").isEqualTo(supervisor.sessionId());
    }

    @Test
    void restoreVoiceReconnectsGivenUpTransport() {
        reconnectFailedHandler.accept(new TransportEvent(EventType.RECONNECT_FAILED, null, null));
        when(transport.status()).thenReturn(
                new ConnectionStatus(ConnectionState.FAILED, 5, "refused", Instant.now()));

        supervisor.restoreVoice();

        verify(transport).forceReconnect();
        assertThat(supervisor.mode()).isEqualTo(InteractionMode.VOICE);
        assertThat(modeChanges).containsExactly("VOICE->TEXT", "TEXT->VOICE");
    }

    @Test
    void failingModeListenerDoesNotBlockOthers() {
        List<String> seen = new ArrayList<>();
        supervisor.addListener((from, to, reason) -> {
            throw new IllegalStateException("listener bug");
        });
        supervisor.addListener((from, to, reason) -> seen.add(reason));

        reconnectFailedHandler.accept(new TransportEvent(EventType.RECONNECT_FAILED, null, null));

        assertThat(seen).containsExactly("connection to server lost");
    }

    private static TransportEvent aiResponse(String text, byte[] audio) {
        return aiResponse(text, audio, null);
    }

    private static TransportEvent aiResponse(String text, byte[] audio, String transcript) {
        ObjectNode data = MAPPER.createObjectNode()
                .put("text", text)
                .put("confidence", 0.9)
                .put("processingTime", 850)
                .put("provider", "groq");
        if (audio != null) {
            data.put("audioBuffer", Base64.getEncoder().encodeToString(audio));
        }
        if (transcript != null) {
            data.put("transcript", transcript);
        }
        return new TransportEvent(EventType.AI_RESPONSE, data, null);
    }
}
