package com.scholary.subtitle.audio;

import java.util.Locale;

/**
 * Audio container formats the engine can write.
 *
 * <p>Chosen from the destination's file extension. Anything else falls back to {@link #MP3}.
 */
public enum ContainerFormat {
  MP3("mp3", "audio/mpeg"),
  WAV("wav", "audio/wav");

  private final String extension;
  private final String contentType;

  ContainerFormat(String extension, String contentType) {
    this.extension = extension;
    this.contentType = contentType;
  }

  public String extension() {
    return extension;
  }

  public String contentType() {
    return contentType;
  }

  /** The fallback used for unknown or missing extensions. */
  public static ContainerFormat defaultFormat() {
    return MP3;
  }

  /** Whether the destination's extension names one of the supported formats. */
  public static boolean isSupported(String destination) {
    return lookup(extensionOf(destination)) != null;
  }

  /**
   * Pick the container format for a destination path or key.
   *
   * @param destination a file path, URI or object key
   * @return the matching format, or {@link #defaultFormat()} if the extension is not supported
   */
  public static ContainerFormat forDestination(String destination) {
    ContainerFormat format = lookup(extensionOf(destination));
    return format != null ? format : defaultFormat();
  }

  private static ContainerFormat lookup(String extension) {
    for (ContainerFormat format : values()) {
      if (format.extension.equals(extension)) {
        return format;
      }
    }
    return null;
  }

  private static String extensionOf(String destination) {
    if (destination == null) {
      return "";
    }
    int slash = Math.max(destination.lastIndexOf('/'), destination.lastIndexOf('\\'));
    String name = destination.substring(slash + 1);
    int dot = name.lastIndexOf('.');
    return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
