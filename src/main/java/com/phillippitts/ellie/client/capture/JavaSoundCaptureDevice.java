package com.phillippitts.ellie.client.capture;

import com.phillippitts.ellie.exception.CaptureError;
import com.phillippitts.ellie.exception.CaptureException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Java Sound microphone producing PCM16LE mono.
 *
 * <p>Acquisition failures map to {@link CaptureError}: a {@link SecurityException} is a denied
 * permission, a line that exists but cannot be opened is busy, a missing line is unavailable and a
 * format no line supports is unsupported.
 */
public class JavaSoundCaptureDevice implements AudioCaptureDevice {

    private static final Logger LOG = LogManager.getLogger(JavaSoundCaptureDevice.class);

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(AudioFormat format, Optional<String> deviceName) throws LineUnavailableException;
    }

    private final int sampleRate;
    private final Optional<String> deviceName;
    private final DataLineProvider provider;
    private volatile TargetDataLine line;

    public JavaSoundCaptureDevice(int sampleRate, String deviceName) {
        this(sampleRate, deviceName, defaultProvider());
    }

    // Package-private for tests
    JavaSoundCaptureDevice(int sampleRate, String deviceName, DataLineProvider provider) {
        this.sampleRate = sampleRate;
        this.deviceName = Optional.ofNullable(deviceName).filter(s -> !s.isBlank());
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    static AudioFormat pcm16Mono(int sampleRate) {
        return new AudioFormat(sampleRate, 16, 1, true, false);
    }

    private static DataLineProvider defaultProvider() {
        return (format, device) -> {
            DataLine.Info info = new DataLine.Info(TargetDataLine.class, format);
            TargetDataLine found = null;
            if (device.isPresent()) {
                for (Mixer.Info mixerInfo : AudioSystem.getMixerInfo()) {
                    if (mixerInfo.getName().equalsIgnoreCase(device.get())) {
                        found = (TargetDataLine) AudioSystem.getMixer(mixerInfo).getLine(info);
                        break;
                    }
                }
                if (found == null) {
                    LOG.warn("Capture device '{}' not found, using system default", device.get());
                }
            }
            if (found == null) {
                if (!AudioSystem.isLineSupported(info)) {
                    throw new IllegalArgumentException("No capture line supports " + format);
                }
                found = (TargetDataLine) AudioSystem.getLine(info);
            }
            found.open(format);
            return found;
        };
    }

    @Override
    public void acquire() {
        if (line != null) {
            throw new CaptureException(CaptureError.DEVICE_BUSY, "Device already acquired");
        }
        AudioFormat format = pcm16Mono(sampleRate);
        try {
            TargetDataLine opened = provider.open(format, deviceName);
            opened.start();
            line = opened;
            LOG.debug("Microphone acquired: device='{}', {} Hz", deviceName.orElse("default"), sampleRate);
        } catch (SecurityException e) {
            throw new CaptureException(CaptureError.PERMISSION_DENIED, "Microphone access denied", e);
        } catch (LineUnavailableException e) {
            throw new CaptureException(classify(e), "Microphone could not be opened: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new CaptureException(CaptureError.UNSUPPORTED, "Capture format not supported: " + format, e);
        }
    }

    static CaptureError classify(LineUnavailableException e) {
        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        if (message.contains("busy") || message.contains("in use") || message.contains("already")) {
            return CaptureError.DEVICE_BUSY;
        }
        return CaptureError.DEVICE_UNAVAILABLE;
    }

    @Override
    public int read(byte[] buffer, int offset, int length) {
        TargetDataLine current = line;
        if (current == null || !current.isOpen()) {
            return -1;
        }
        return current.read(buffer, offset, length);
    }

    @Override
    public void release() {
        TargetDataLine current = line;
        line = null;
        if (current == null) {
            return;
        }
        try {
            current.stop();
        } catch (RuntimeException e) {
            LOG.debug("Ignoring failure stopping line: {}", e.toString());
        }
        try {
            current.close();
        } catch (RuntimeException e) {
            LOG.debug("Ignoring failure closing line: {}", e.toString());
        }
    }

    @Override
    public int sampleRate() {
        return sampleRate;
    }
}
