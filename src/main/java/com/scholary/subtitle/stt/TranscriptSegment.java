package com.scholary.subtitle.stt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A timed piece of recognized speech, as returned by the speech-to-text service.
 *
 * <p>Times are seconds from the start of the audio.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranscriptSegment(double start, double end, String text) {}
