package com.phillippitts.ellie.client.degradation;

@FunctionalInterface
public interface ModeListener {
    void onModeChanged(InteractionMode from, InteractionMode to, String reason);
}
