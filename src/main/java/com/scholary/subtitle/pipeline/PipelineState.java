package com.scholary.subtitle.pipeline;

/** Stages of the transcription pipeline. */
public enum PipelineState {
  IDLE,
  EXTRACTING,
  TRANSCRIBING,
  TRANSLATING,
  SERIALIZING,
  DONE,
  FAILED;

  public boolean isTerminal() {
    return this == DONE || this == FAILED;
  }
}
