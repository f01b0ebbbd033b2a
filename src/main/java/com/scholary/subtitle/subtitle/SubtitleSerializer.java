package com.scholary.subtitle.subtitle;

import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Renders segments as subtitle text.
 *
 * <p>Format:
 *
 * <pre>
 * 1
 * 00:00:00,000 --> 00:00:05,200
 * Hello world
 *
 * 2
 * 00:00:05,200 --> 00:00:10,300
 * This is a test
 *
 * </pre>
 *
 * <p>Blocks are numbered from 1 in list order, whatever index the segments carry. Every block,
 * including the last, is followed by a blank line. Timing is written as given: no check that
 * {@code end > start} or that blocks do not overlap.
 */
@Component
public class SubtitleSerializer {

  public String serialize(List<Segment> segments) {
    StringBuilder srt = new StringBuilder();

    for (int i = 0; i < segments.size(); i++) {
      Segment segment = segments.get(i);

      srt.append(i + 1).append("\n");

      srt.append(TimestampCodec.encode(segment.start()))
          .append(" --> ")
          .append(TimestampCodec.encode(segment.end()))
          .append("\n");

      srt.append(segment.text().stripTrailing()).append("\n");

      srt.append("\n");
    }

    return srt.toString();
  }
}
