package com.phillippitts.ellie.client.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventCodecTest {

    private final EventCodec codec = new EventCodec(new ObjectMapper());

    @Test
    void encodesEnvelopeWithWireName() {
        String json = codec.encode(EventType.VOICE_INPUT, Map.of("format", "wav"));

        assertThat(json).isEqualTo("{\"type\":\"voice-input\",\"data\":{\"format\":\"wav\"}}");
    }

    @Test
    void nullPayloadBecomesEmptyObject() {
        assertThat(codec.encode(EventType.PONG, null)).isEqualTo("{\"type\":\"pong\",\"data\":{}}");
    }

    @Test
    void lifecycleTypesAreNotEncodable() {
        assertThatThrownBy(() -> codec.encode(EventType.RECONNECT, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void decodesKnownEvent() {
        TransportEvent event = codec.decode("{\"type\":\"ai-response\",\"data\":{\"text\":\"Hi\",\"cached\":true}}")
                .orElseThrow();

        assertThat(event.type()).isEqualTo(EventType.AI_RESPONSE);
        assertThat(event.text("text")).isEqualTo("Hi");
        assertThat(event.text("cached")).isEqualTo("true");
        assertThat(event.text("missing")).isNull();
    }

    @Test
    void missingDataDecodesAsEmptyObject() {
        TransportEvent event = codec.decode("{\"type\":\"ping\"}").orElseThrow();

        assertThat(event.data().isObject()).isTrue();
        assertThat(event.data().size()).isZero();
    }

    @Test
    void ignoresMalformedAndUnknownFrames() {
        assertThat(codec.decode("not json")).isEmpty();
        assertThat(codec.decode("[1,2]")).isEmpty();
        assertThat(codec.decode("{\"type\":\"telepathy\",\"data\":{}}")).isEmpty();
        assertThat(codec.decode("{\"data\":{}}")).isEmpty();
        assertThat(codec.decode("{\"type\":\"connect\"}")).isEmpty();
    }
}
