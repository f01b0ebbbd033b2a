package com.scholary.subtitle.pipeline;

/** Receives human-readable progress messages from a running pipeline. */
@FunctionalInterface
public interface ProgressChannel {

  void progress(String message);
}
