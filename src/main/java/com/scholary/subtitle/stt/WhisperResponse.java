package com.scholary.subtitle.stt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** Response body of the Whisper transcription API. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperResponse(List<TranscriptSegment> segments, String text, String language) {}
