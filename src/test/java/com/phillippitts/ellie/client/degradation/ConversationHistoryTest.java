package com.phillippitts.ellie.client.degradation;

import com.phillippitts.ellie.domain.Message;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversationHistoryTest {

    @Test
    void dropsOldestBeyondCapacity() {
        ConversationHistory history = new ConversationHistory(2);

        history.add(Message.user("one"));
        history.add(Message.user("two"));
        history.add(Message.user("three"));

        assertThat(history.size()).isEqualTo(2);
        assertThat(history.snapshot()).extracting(Message::text).containsExactly("two", "three");
    }

    @Test
    void snapshotIsDetached() {
        ConversationHistory history = new ConversationHistory(5);
        history.add(Message.user("hi"));

        var snapshot = history.snapshot();
        history.add(Message.user("again"));

        assertThat(snapshot).hasSize(1);
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new ConversationHistory(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
