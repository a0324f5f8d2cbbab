package com.phillippitts.ellie.client.capture;

import com.phillippitts.ellie.config.properties.ClientProperties;
import com.phillippitts.ellie.domain.AudioInput;
import com.phillippitts.ellie.exception.CaptureError;
import com.phillippitts.ellie.exception.CaptureException;
import com.phillippitts.ellie.util.WavEncoder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Push-to-talk capture state machine.
 *
 * <p>Transitions:
 * <ul>
 *   <li>IDLE to LISTENING on {@link #startCapture()}; acquisition failures leave the state IDLE</li>
 *   <li>LISTENING to PROCESSING on {@link #stopCapture()}, or back to IDLE when nothing was heard</li>
 *   <li>PROCESSING to SPEAKING on {@link #onResponseAudio()}</li>
 *   <li>SPEAKING (or PROCESSING, for replies without audio) to IDLE on {@link #onPlaybackComplete()}</li>
 *   <li>any state to ERROR on {@link #fail(String)}, ERROR to IDLE on {@link #retry()}</li>
 * </ul>
 *
 * <p>The device is opened on a dedicated capture thread that feeds a {@link PcmRingBuffer}.
 * {@link #startCapture()} waits for the open to finish so the caller learns about permission or
 * device errors immediately. The wait has no limit unless {@code permission-wait-ms} is set, since
 * the OS permission prompt stays up until the user answers it; {@link #cancel()} ends the wait.
 * Each acquired device is released exactly once by that thread.
 * Listener callbacks run outside the internal lock.
 */
public class CaptureController {

    private static final Logger LOG = LogManager.getLogger(CaptureController.class);

    private static final long JOIN_TIMEOUT_MS = 2_000;
    private static final int BYTES_PER_SAMPLE = 2;

    private final AudioCaptureDevice device;
    private final long maxDurationMs;
    private final int chunkMillis;
    private final long permissionWaitMs;
    private final ApplicationEventPublisher publisher;
    private final List<VoiceStateListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();
    private VoiceState state = VoiceState.IDLE;
    private Recording current;

    public CaptureController(AudioCaptureDevice device, ClientProperties.Capture props,
                             ApplicationEventPublisher publisher) {
        this(device, props.getMaxDurationMs(), props.getChunkMillis(), props.getPermissionWaitMs(), publisher);
    }

    /**
     * @param permissionWaitMs how long {@link #startCapture()} waits for the device to open;
     *                         0 waits until the open finishes or the capture is cancelled
     */
    CaptureController(AudioCaptureDevice device, long maxDurationMs, int chunkMillis, long permissionWaitMs,
                      ApplicationEventPublisher publisher) {
        if (maxDurationMs <= 0 || chunkMillis <= 0) {
            throw new IllegalArgumentException("maxDurationMs and chunkMillis must be positive");
        }
        if (permissionWaitMs < 0) {
            throw new IllegalArgumentException("permissionWaitMs must not be negative");
        }
        this.permissionWaitMs = permissionWaitMs;
        this.device = Objects.requireNonNull(device, "device");
        this.maxDurationMs = maxDurationMs;
        this.chunkMillis = chunkMillis;
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    public void addListener(VoiceStateListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(VoiceStateListener listener) {
        listeners.remove(listener);
    }

    public VoiceState currentState() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * Opens the microphone and starts recording.
     *
     * @throws CaptureException      when the device cannot be acquired; the state stays IDLE
     * @throws IllegalStateException when not IDLE or a capture is already starting
     */
    public void startCapture() {
        Recording rec;
        synchronized (lock) {
            if (state != VoiceState.IDLE || current != null) {
                throw new IllegalStateException("Cannot start capture in state " + state);
            }
            rec = new Recording(bytesFor(maxDurationMs));
            current = rec;
        }
        Thread t = new Thread(() -> runCapture(rec), "audio-capture");
        t.setDaemon(true);
        rec.thread = t;
        t.start();

        try {
            if (permissionWaitMs > 0) {
                rec.acquired.get(permissionWaitMs, TimeUnit.MILLISECONDS);
            } else {
                rec.acquired.get();
            }
        } catch (CancellationException e) {
            LOG.debug("Capture cancelled while the microphone was opening");
            return;
        } catch (ExecutionException e) {
            CaptureException failure = e.getCause() instanceof CaptureException ce
                    ? ce
                    : new CaptureException(CaptureError.DEVICE_UNAVAILABLE, "Microphone failed to open", e.getCause());
            throw abandon(rec, failure);
        } catch (TimeoutException e) {
            throw abandon(rec, new CaptureException(CaptureError.DEVICE_UNAVAILABLE,
                    "Microphone did not open within " + permissionWaitMs + "ms"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw abandon(rec, new CaptureException(CaptureError.DEVICE_UNAVAILABLE,
                    "Interrupted while opening microphone", e));
        }

        VoiceState from;
        synchronized (lock) {
            if (current != rec) {
                // cancelled while the device was opening
                return;
            }
            from = transition(VoiceState.LISTENING);
        }
        notifyTransition(from, VoiceState.LISTENING);
    }

    /**
     * Stops recording and hands over the captured audio as WAV.
     *
     * @return the utterance, or empty when not listening or nothing was captured
     */
    public Optional<AudioInput> stopCapture() {
        Recording rec;
        synchronized (lock) {
            if (state != VoiceState.LISTENING || current == null) {
                return Optional.empty();
            }
            rec = current;
        }
        rec.active.set(false);
        join(rec.thread);
        byte[] pcm = rec.buffer.snapshot();

        VoiceState from;
        VoiceState to;
        synchronized (lock) {
            if (current != rec || state != VoiceState.LISTENING) {
                return Optional.empty();
            }
            current = null;
            to = pcm.length == 0 ? VoiceState.IDLE : VoiceState.PROCESSING;
            from = transition(to);
        }
        notifyTransition(from, to);
        if (pcm.length == 0) {
            LOG.debug("Capture produced no audio; discarded");
            return Optional.empty();
        }
        int sampleRate = device.sampleRate();
        long durationMs = pcm.length * 1000L / ((long) sampleRate * BYTES_PER_SAMPLE);
        return Optional.of(new AudioInput(WavEncoder.encodePcm16Le(pcm, sampleRate, 1), "wav", durationMs));
    }

    /** A reply with audio arrived: PROCESSING to SPEAKING. */
    public boolean onResponseAudio() {
        return move(VoiceState.PROCESSING, VoiceState.SPEAKING);
    }

    /** Playback finished, or the reply had no audio: back to IDLE. */
    public boolean onPlaybackComplete() {
        return move(VoiceState.SPEAKING, VoiceState.IDLE) || move(VoiceState.PROCESSING, VoiceState.IDLE);
    }

    /**
     * Enters ERROR from any state, discarding a recording in progress.
     */
    public void fail(String reason) {
        VoiceState from;
        Recording rec;
        synchronized (lock) {
            if (state == VoiceState.ERROR) {
                return;
            }
            rec = current;
            current = null;
            from = transition(VoiceState.ERROR);
        }
        discard(rec);
        LOG.warn("Voice interaction failed: {}", reason);
        notifyTransition(from, VoiceState.ERROR);
    }

    /** ERROR to IDLE. */
    public boolean retry() {
        return move(VoiceState.ERROR, VoiceState.IDLE);
    }

    /**
     * Abandons the current interaction. A recording in progress is discarded. ERROR is left alone.
     */
    public void cancel() {
        VoiceState from;
        Recording rec;
        synchronized (lock) {
            rec = current;
            current = null;
            if (state == VoiceState.IDLE || state == VoiceState.ERROR) {
                from = null;
            } else {
                from = transition(VoiceState.IDLE);
            }
        }
        discard(rec);
        if (from != null) {
            notifyTransition(from, VoiceState.IDLE);
        }
    }

    /** Releases the device if a recording is in progress. */
    public void shutdown() {
        Recording rec;
        synchronized (lock) {
            rec = current;
            current = null;
        }
        if (rec != null) {
            LOG.info("Shutting down with an active recording; forcing cleanup");
            discard(rec);
            join(rec.thread);
        }
    }

    private void runCapture(Recording rec) {
        boolean acquired = false;
        try {
            device.acquire();
            acquired = true;
            rec.acquired.complete(null);

            byte[] chunk = new byte[Math.max(BYTES_PER_SAMPLE, bytesFor(chunkMillis))];
            long ceiling = bytesFor(maxDurationMs);
            long written = 0;
            while (rec.active.get()) {
                int n = device.read(chunk, 0, chunk.length);
                if (n < 0) {
                    if (rec.active.get()) {
                        LOG.warn("Capture device stopped delivering audio after {} bytes", written);
                        notice(CaptureNotice.deviceLost());
                    }
                    break;
                }
                if (n == 0) {
                    continue;
                }
                // a short read can leave the last chunk past the ceiling; the ring would wrap onto the start
                int kept = (int) Math.min(n, ceiling - written);
                rec.buffer.write(chunk, 0, kept);
                written += kept;
                if (written >= ceiling) {
                    LOG.info("Max capture duration reached ({} ms)", maxDurationMs);
                    notice(CaptureNotice.maxDurationReached(maxDurationMs));
                    break;
                }
            }
            LOG.debug("Capture loop finished: {} bytes", written);
        } catch (CaptureException e) {
            rec.acquired.completeExceptionally(e);
        } catch (RuntimeException e) {
            if (acquired) {
                LOG.warn("Capture failed mid-recording: {}", e.toString());
                notice(CaptureNotice.deviceLost());
            } else {
                rec.acquired.completeExceptionally(e);
            }
        } finally {
            rec.active.set(false);
            if (acquired) {
                device.release();
            }
        }
    }

    private CaptureException abandon(Recording rec, CaptureException failure) {
        rec.active.set(false);
        synchronized (lock) {
            if (current == rec) {
                current = null;
            }
        }
        LOG.warn("Microphone acquisition failed: {}", failure.getCaptureError());
        publisher.publishEvent(new CaptureErrorEvent(failure.getCaptureError(), Instant.now()));
        return failure;
    }

    private boolean move(VoiceState expected, VoiceState to) {
        VoiceState from;
        synchronized (lock) {
            if (state != expected) {
                return false;
            }
            from = transition(to);
        }
        notifyTransition(from, to);
        return true;
    }

    // Caller holds lock
    private VoiceState transition(VoiceState to) {
        VoiceState from = state;
        state = to;
        return from;
    }

    private void notifyTransition(VoiceState from, VoiceState to) {
        LOG.debug("Voice state {} -> {}", from, to);
        for (VoiceStateListener listener : listeners) {
            try {
                listener.onStateChanged(from, to);
            } catch (RuntimeException e) {
                LOG.warn("Voice state listener failed: {}", e.toString());
            }
        }
    }

    private void notice(CaptureNotice notice) {
        for (VoiceStateListener listener : listeners) {
            try {
                listener.onNotice(notice);
            } catch (RuntimeException e) {
                LOG.warn("Capture notice listener failed: {}", e.toString());
            }
        }
    }

    private static void discard(Recording rec) {
        if (rec != null) {
            rec.active.set(false);
            rec.acquired.cancel(false);
            rec.buffer.clear();
        }
    }

    private int bytesFor(long millis) {
        return (int) (millis * device.sampleRate() * BYTES_PER_SAMPLE / 1000L);
    }

    private static void join(Thread thread) {
        if (thread == null || !thread.isAlive() || thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(JOIN_TIMEOUT_MS);
            if (thread.isAlive()) {
                LOG.warn("Capture thread did not terminate within {}ms", JOIN_TIMEOUT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for capture thread to terminate");
        }
    }

    private static final class Recording {
        final AtomicBoolean active = new AtomicBoolean(true);
        final CompletableFuture<Void> acquired = new CompletableFuture<>();
        final PcmRingBuffer buffer;
        volatile Thread thread;

        Recording(int capacityBytes) {
            this.buffer = new PcmRingBuffer(capacityBytes);
        }
    }
}
