package com.scholary.subtitle.synthesis;

/**
 * The voices a caller can choose from.
 *
 * <p>Each selector maps to exactly one backend. Edge voices carry their neural voice name.
 */
public enum VoiceSelector {
  GOOGLE_TTS(Backend.GOOGLE_TTS, null),
  EDGE_ARIA(Backend.EDGE_TTS, "en-US-AriaNeural"),
  EDGE_GUY(Backend.EDGE_TTS, "en-US-GuyNeural"),
  EDGE_SREYMOM(Backend.EDGE_TTS, "km-KH-SreymomNeural"),
  SYSTEM_DEFAULT(Backend.ESPEAK, null);

  /** Synthesis backends. */
  public enum Backend {
    GOOGLE_TTS,
    EDGE_TTS,
    ESPEAK
  }

  private final Backend backend;
  private final String voiceName;

  VoiceSelector(Backend backend, String voiceName) {
    this.backend = backend;
    this.voiceName = voiceName;
  }

  public Backend backend() {
    return backend;
  }

  /** The backend-specific voice name, or null when the backend picks its own. */
  public String voiceName() {
    return voiceName;
  }
}
