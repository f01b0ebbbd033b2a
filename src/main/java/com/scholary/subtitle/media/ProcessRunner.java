package com.scholary.subtitle.media;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs external command-line tools (ffmpeg, ffprobe, edge-tts, espeak-ng).
 *
 * <p>stderr is merged into stdout and drained line by line on a separate thread, so a chatty
 * process cannot block on a full pipe and the timeout is enforced while the process still holds its
 * output open. Only the first {@value #MAX_OUTPUT_LINES} lines are kept.
 */
@Component
public class ProcessRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessRunner.class);
  private static final int MAX_OUTPUT_LINES = 1000;
  private static final long OUTPUT_DRAIN_MILLIS = 2000;

  /** Exit code and captured output of a finished process. */
  public record Result(int exitCode, String output) {

    public boolean isSuccess() {
      return exitCode == 0;
    }

    /** The output, cut to {@code maxChars} for error messages. */
    public String outputSnippet(int maxChars) {
      return output.length() <= maxChars ? output : output.substring(0, maxChars) + "...";
    }
  }

  /**
   * Run a command and wait for it to finish.
   *
   * @param command the command and its arguments
   * @param taskName short name used in logs and error messages
   * @param timeout how long to wait before killing the process
   * @return the exit code and captured output
   * @throws IOException if the process cannot be started or is interrupted
   * @throws TimeoutException if the process does not finish in time
   */
  public Result run(List<String> command, String taskName, Duration timeout)
      throws IOException, TimeoutException {
    LOGGER.debug("Starting {}: {}", taskName, String.join(" ", command));

    ProcessBuilder pb = new ProcessBuilder(command);
    pb.redirectErrorStream(true);
    Process process = pb.start();

    StringBuilder output = new StringBuilder();
    Thread reader = new Thread(() -> drain(process, output, taskName), taskName + "-output");
    reader.setDaemon(true);
    reader.start();

    try {
      boolean completed = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!completed) {
        process.destroyForcibly();
        reader.join(OUTPUT_DRAIN_MILLIS);
        LOGGER.error("{} timed out after {}", taskName, timeout);
        throw new TimeoutException(taskName + " timed out after " + timeout);
      }
      reader.join(OUTPUT_DRAIN_MILLIS);
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new IOException(taskName + " interrupted", e);
    }

    int exitCode = process.exitValue();
    if (exitCode != 0) {
      LOGGER.warn("{} failed with exit code {}", taskName, exitCode);
    } else {
      LOGGER.debug("{} completed successfully", taskName);
    }
    synchronized (output) {
      return new Result(exitCode, output.toString());
    }
  }

  private static void drain(Process process, StringBuilder output, String taskName) {
    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
      String line;
      int lineCount = 0;
      while ((line = reader.readLine()) != null) {
        if (lineCount < MAX_OUTPUT_LINES) {
          synchronized (output) {
            output.append(line).append("\n");
          }
          lineCount++;
        }
      }
    } catch (IOException e) {
      // stream is closed when a timed-out process is killed
      LOGGER.debug("Stopped reading {} output: {}", taskName, e.getMessage());
    }
  }
}
