package com.scholary.subtitle.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.subtitle.audio.AudioClip;
import com.scholary.subtitle.audio.AudioEncoder;
import com.scholary.subtitle.audio.ContainerFormat;
import com.scholary.subtitle.exception.ExternalServiceException;
import com.scholary.subtitle.exception.ResourceException;
import com.scholary.subtitle.storage.OutputStore;
import com.scholary.subtitle.subtitle.SubtitleParser;
import com.scholary.subtitle.synthesis.SpeechSynthesizer;
import com.scholary.subtitle.synthesis.SynthesisException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class VoiceGenerationPipelineTest {

  private static final String SUBTITLES =
      "1\n00:00:00,000 --> 00:00:01,000\nHello\n\n" + "2\n00:00:02,000 --> 00:00:03,000\nWorld\n";

  @Mock private SpeechSynthesizer backend;
  @Mock private AudioEncoder encoder;
  @Mock private OutputStore outputStore;

  private RecordingContext context;

  @BeforeEach
  void setUp() {
    context = new RecordingContext();
  }

  private VoiceGenerationPipeline pipeline(String subtitleText, String destination) {
    return pipeline(SubtitleSource.inline(subtitleText), destination);
  }

  private VoiceGenerationPipeline pipeline(SubtitleSource source, String destination) {
    return new VoiceGenerationPipeline(
        new SubtitleParser(),
        new TimelineAudioSynthesizer(backend, 1000, 1, 3600),
        encoder,
        outputStore,
        source,
        destination,
        "en");
  }

  @Test
  void run_shouldAssembleEncodeAndWriteTrack() throws Exception {
    when(backend.synthesize(anyString(), eq("en"))).thenReturn(AudioClip.silence(500, 1000, 1));
    when(encoder.encode(any(), eq(ContainerFormat.WAV))).thenReturn(new byte[] {9});

    SynthesisReport report = pipeline(SUBTITLES, "/out/voice.wav").run(context);

    ArgumentCaptor<AudioClip> clip = ArgumentCaptor.forClass(AudioClip.class);
    verify(encoder).encode(clip.capture(), eq(ContainerFormat.WAV));
    assertThat(clip.getValue().frameCount()).isEqualTo(500 + 1000 + 500);
    verify(outputStore).write("/out/voice.wav", new byte[] {9}, "audio/wav");

    assertThat(report.destination()).isEqualTo("/out/voice.wav");
    assertThat(report.format()).isEqualTo(ContainerFormat.WAV);
    assertThat(report.segmentCount()).isEqualTo(2);
    assertThat(report.synthesized()).isEqualTo(2);
    assertThat(report.skipped()).isZero();
    assertThat(report.durationSeconds()).isEqualTo(2.0);
    assertThat(context.messages)
        .containsExactly(
            "Generating voice audio based on timeline...", "Voice audio saved to /out/voice.wav");
  }

  @Test
  void run_shouldFallBackToMp3AndKeepDestinationPath() throws Exception {
    when(backend.synthesize(anyString(), eq("en"))).thenReturn(AudioClip.silence(10, 1000, 1));
    when(encoder.encode(any(), eq(ContainerFormat.MP3))).thenReturn(new byte[] {1});

    SynthesisReport report = pipeline(SUBTITLES, "/out/voice.ogg").run(context);

    verify(outputStore).write("/out/voice.ogg", new byte[] {1}, "audio/mpeg");
    assertThat(report.format()).isEqualTo(ContainerFormat.MP3);
  }

  @Test
  void run_shouldSucceedWithEmptyReportWhenNoSegments() {
    SynthesisReport report = pipeline("no subtitles here", "/out/voice.mp3").run(context);

    assertThat(report).isEqualTo(SynthesisReport.empty());
    assertThat(report.hasOutput()).isFalse();
    assertThat(context.messages)
        .containsExactly(
            "Generating voice audio based on timeline...", "No valid subtitle segments found.");
    verifyNoInteractions(backend, encoder, outputStore);
  }

  @Test
  void run_shouldWriteTrackEvenWhenSomeSegmentsFail() throws Exception {
    when(backend.synthesize("Hello", "en")).thenThrow(new SynthesisException("rate limited"));
    when(backend.synthesize("World", "en")).thenReturn(AudioClip.silence(1000, 1000, 1));
    when(encoder.encode(any(), eq(ContainerFormat.MP3))).thenReturn(new byte[] {1});

    SynthesisReport report = pipeline(SUBTITLES, "/out/voice.mp3").run(context);

    assertThat(report.synthesized()).isEqualTo(1);
    assertThat(report.skipped()).isEqualTo(1);
    // 1s of silence from the failed segment's end to the next start, then the clip
    assertThat(report.durationSeconds()).isEqualTo(2.0);
    assertThat(context.messages)
        .contains("Skipping segment 1 due to synthesis error: rate limited");
  }

  @Test
  void run_shouldFailWithoutWritingWhenEncodingFails() throws Exception {
    when(backend.synthesize(anyString(), eq("en"))).thenReturn(AudioClip.silence(10, 1000, 1));
    when(encoder.encode(any(), any())).thenThrow(new ExternalServiceException("lame missing"));

    assertThatThrownBy(() -> pipeline(SUBTITLES, "/out/voice.mp3").run(context))
        .isInstanceOf(ExternalServiceException.class)
        .hasMessage("lame missing");
    verify(outputStore, never()).write(anyString(), any(), anyString());
  }

  @Test
  void run_shouldReadStoredSubtitlesInsideTheRun() throws Exception {
    when(outputStore.readText("s3://media/talk.srt")).thenReturn(SUBTITLES);
    when(backend.synthesize(anyString(), eq("en"))).thenReturn(AudioClip.silence(500, 1000, 1));
    when(encoder.encode(any(), eq(ContainerFormat.WAV))).thenReturn(new byte[] {9});

    SynthesisReport report =
        pipeline(SubtitleSource.stored("s3://media/talk.srt"), "/out/voice.wav").run(context);

    assertThat(report.segmentCount()).isEqualTo(2);
    assertThat(context.messages).contains("Reading subtitles from s3://media/talk.srt");
  }

  @Test
  void run_shouldFailWhenStoredSubtitlesCannotBeRead() {
    when(outputStore.readText("/in/missing.srt"))
        .thenThrow(new ResourceException("Failed to read /in/missing.srt"));

    assertThatThrownBy(
            () -> pipeline(SubtitleSource.stored("/in/missing.srt"), "/out/voice.wav").run(context))
        .isInstanceOf(ResourceException.class)
        .hasMessage("Failed to read /in/missing.srt");
    verifyNoInteractions(backend, encoder);
  }
}
