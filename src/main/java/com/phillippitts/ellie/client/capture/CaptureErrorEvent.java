package com.phillippitts.ellie.client.capture;

import com.phillippitts.ellie.exception.CaptureError;

import java.time.Instant;

/**
 * Published when the microphone cannot be acquired. Carries no audio or user data.
 */
public record CaptureErrorEvent(CaptureError reason, Instant at) { }
