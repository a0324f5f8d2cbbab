package com.phillippitts.ellie.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExceptionHierarchyTest {

    @Test
    void ellieExceptionDefaultsToInternalError() {
        IOException cause = new IOException("IO failure");
        EllieException ex = new EllieException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.INTERNAL_SERVER_ERROR);
    }

    @Test
    void providerExceptionNamesProvider() {
        ProviderException ex = new ProviderException("chat failed", "groq");

        assertThat(ex.getMessage()).contains("chat failed").contains("groq");
        assertThat(ex.getProviderName()).isEqualTo("groq");
        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.EXTERNAL_API_ERROR);
    }

    @Test
    void builderAppendsDiagnosticsInOrder() {
        ProviderException ex = ProviderExceptionBuilder.create("Chat completion failed")
                .provider("openai")
                .statusCode(429)
                .durationMs(812)
                .metadata("model", "gpt-4")
                .metadata("ignored", null)
                .build();

        assertThat(ex.getMessage()).isEqualTo(
                "Chat completion failed (status=429, durationMs=812, model=gpt-4) (provider: openai)");
        assertThat(ex).isNotInstanceOf(ProviderTimeoutException.class);
    }

    @Test
    void builderWithTimeoutBuildsTimeoutException() {
        ProviderException ex = ProviderExceptionBuilder.create("Transcription timed out")
                .provider("whisper")
                .timeout(5000)
                .build();

        assertThat(ex).isInstanceOfSatisfying(ProviderTimeoutException.class,
                timeout -> assertThat(timeout.getTimeoutMs()).isEqualTo(5000));
        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.CONNECTION_TIMEOUT);
    }

    @Test
    void builderRequiresMessage() {
        assertThatThrownBy(() -> ProviderExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(ProviderExceptionBuilder.create("x").build().getProviderName()).isEqualTo("unknown");
    }

    @Test
    void captureErrorsMapToWireCodes() {
        CaptureException denied = new CaptureException(CaptureError.PERMISSION_DENIED, "denied");

        assertThat(denied.getCaptureError().isRecoverable()).isFalse();
        assertThat(denied.getErrorCode()).isEqualTo(ErrorCode.MICROPHONE_PERMISSION_DENIED);
        assertThat(CaptureError.DEVICE_BUSY.isRecoverable()).isTrue();
    }

    @Test
    void allExceptionsShouldBeRuntimeExceptions() {
        assertThat(new EllieException("test")).isInstanceOf(RuntimeException.class);
        assertThat(new InvalidAudioException("test")).isInstanceOf(EllieException.class);
        assertThat(new TransportException(TransportError.TIMEOUT, "late")).isInstanceOf(EllieException.class);
    }
}
