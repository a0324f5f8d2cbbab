package com.phillippitts.ellie.config.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.ellie.client.capture.CaptureController;
import com.phillippitts.ellie.client.capture.JavaSoundCaptureDevice;
import com.phillippitts.ellie.client.degradation.ConversationHistory;
import com.phillippitts.ellie.client.degradation.DegradationSupervisor;
import com.phillippitts.ellie.client.degradation.HttpTextChannel;
import com.phillippitts.ellie.client.playback.JavaSoundAudioPlayer;
import com.phillippitts.ellie.client.transport.BackoffPolicy;
import com.phillippitts.ellie.client.transport.EventCodec;
import com.phillippitts.ellie.client.transport.JdkWebSocketConnector;
import com.phillippitts.ellie.client.transport.ReconnectingSessionTransport;
import com.phillippitts.ellie.config.properties.ClientProperties;
import com.phillippitts.ellie.config.properties.SessionProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Duration;

/**
 * Embedded voice client. Off by default so the server runs on hosts without a microphone.
 */
@Configuration
@ConditionalOnProperty(prefix = "ellie.client", name = "enabled", havingValue = "true")
public class ClientConfig {

    private final ClientProperties props;

    public ClientConfig(ClientProperties props) {
        this.props = props;
    }

    @Bean(destroyMethod = "shutdown")
    public CaptureController captureController(ApplicationEventPublisher publisher) {
        ClientProperties.Capture capture = props.getCapture();
        JavaSoundCaptureDevice device = new JavaSoundCaptureDevice(capture.getSampleRate(), capture.getDeviceName());
        return new CaptureController(device, capture, publisher);
    }

    @Bean(destroyMethod = "shutdown")
    public ReconnectingSessionTransport sessionTransport(ObjectMapper objectMapper) {
        return new ReconnectingSessionTransport(
                URI.create(props.getServerUrl()),
                new JdkWebSocketConnector(Duration.ofMillis(props.getConnectTimeoutMs())),
                new EventCodec(objectMapper),
                BackoffPolicy.from(props.getReconnect()));
    }

    @Bean
    public HttpTextChannel httpTextChannel() {
        return new HttpTextChannel(WebClient.builder().baseUrl(props.getHttpBaseUrl()).build(),
                Duration.ofMillis(props.getResponseTimeoutMs()));
    }

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public DegradationSupervisor degradationSupervisor(CaptureController captureController,
                                                       ReconnectingSessionTransport sessionTransport,
                                                       HttpTextChannel httpTextChannel,
                                                       SessionProperties sessionProperties) {
        return new DegradationSupervisor(captureController, sessionTransport, httpTextChannel,
                new JavaSoundAudioPlayer(), new ConversationHistory(sessionProperties.getMaxHistoryMessages()),
                props.getMaxVoiceFailures(), Duration.ofMillis(props.getResponseTimeoutMs()));
    }
}
