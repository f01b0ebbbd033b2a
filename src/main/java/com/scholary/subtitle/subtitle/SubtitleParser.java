package com.scholary.subtitle.subtitle;

import com.scholary.subtitle.exception.SubtitleFormatException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Recovers segments from subtitle text.
 *
 * <p>The text is split into blocks on blank lines. A block is accepted when it has at least three
 * lines, its second line holds exactly one {@code -->} separator with a valid timestamp on each
 * side, and it is kept in the order it appears. Everything from the third line on becomes the
 * segment text.
 *
 * <p>Malformed blocks are skipped without error. Subtitle text is often edited by hand, and one
 * broken block should not cost the rest of the file. Skips are only visible at DEBUG level.
 */
@Component
public class SubtitleParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubtitleParser.class);

  private static final Pattern BLOCK_SEPARATOR = Pattern.compile("\\n\\s*\\n");
  private static final String TIMING_SEPARATOR = "-->";
  private static final int MIN_BLOCK_LINES = 3;

  public List<Segment> parse(String subtitleText) {
    if (subtitleText == null) {
      return List.of();
    }

    String normalized = normalize(subtitleText);
    if (normalized.isEmpty()) {
      return List.of();
    }

    List<Segment> segments = new ArrayList<>();
    String[] blocks = BLOCK_SEPARATOR.split(normalized);

    for (int blockNumber = 0; blockNumber < blocks.length; blockNumber++) {
      String[] lines = blocks[blockNumber].split("\n");
      try {
        segments.add(parseBlock(lines, segments.size() + 1));
      } catch (SubtitleFormatException e) {
        LOGGER.debug("Skipping subtitle block {}: {}", blockNumber + 1, e.getMessage());
      }
    }

    LOGGER.debug("Parsed {} segments from {} blocks", segments.size(), blocks.length);
    return segments;
  }

  private Segment parseBlock(String[] lines, int index) {
    if (lines.length < MIN_BLOCK_LINES) {
      throw new SubtitleFormatException(
          String.format("Block has %d lines, expected at least %d", lines.length, MIN_BLOCK_LINES));
    }

    String timing = lines[1];
    String[] sides = timing.split(TIMING_SEPARATOR, -1);
    if (sides.length != 2) {
      throw new SubtitleFormatException("Timing line has no single separator: '" + timing + "'");
    }

    double start = TimestampCodec.decode(sides[0].strip());
    double end = TimestampCodec.decode(sides[1].strip());
    String text = String.join("\n", Arrays.asList(lines).subList(2, lines.length)).strip();

    return new Segment(index, start, end, text);
  }

  private String normalize(String text) {
    String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
    if (normalized.startsWith("\uFEFF")) {
      normalized = normalized.substring(1);
    }
    return normalized.strip();
  }
}
