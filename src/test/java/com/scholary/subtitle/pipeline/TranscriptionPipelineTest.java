package com.scholary.subtitle.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.subtitle.exception.ExternalServiceException;
import com.scholary.subtitle.exception.ResourceException;
import com.scholary.subtitle.media.AudioExtractor;
import com.scholary.subtitle.media.ExtractedAudio;
import com.scholary.subtitle.storage.OutputStore;
import com.scholary.subtitle.storage.ScopedTempFile;
import com.scholary.subtitle.stt.SpeechToTextClient;
import com.scholary.subtitle.stt.Transcript;
import com.scholary.subtitle.stt.TranscriptSegment;
import com.scholary.subtitle.subtitle.Segment;
import com.scholary.subtitle.subtitle.SubtitleSerializer;
import com.scholary.subtitle.translation.TranslationClient;
import com.scholary.subtitle.translation.TranslationException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TranscriptionPipelineTest {

  private static final String MEDIA = "/media/talk.mp4";
  private static final String DESTINATION = "/out/talk.srt";

  @Mock private AudioExtractor extractor;
  @Mock private SpeechToTextClient speechToText;
  @Mock private TranslationClient translationClient;
  @Mock private OutputStore outputStore;

  @TempDir Path tempDir;

  private TranscriptionPipeline pipeline;
  private RecordingContext context;
  private Path extractedFile;

  @BeforeEach
  void setUp() {
    pipeline =
        new TranscriptionPipeline(
            extractor,
            speechToText,
            translationClient,
            new SubtitleSerializer(),
            outputStore,
            MEDIA,
            DESTINATION,
            "km");
    context = new RecordingContext();
  }

  private void givenExtractedAudio(double duration) throws Exception {
    ScopedTempFile wav = ScopedTempFile.create(tempDir, "extract_", ".wav");
    extractedFile = wav.path();
    when(extractor.extract(MEDIA)).thenReturn(new ExtractedAudio(wav, duration));
    when(speechToText.describe()).thenReturn("whisper (base)");
  }

  private String writtenText() {
    ArgumentCaptor<byte[]> content = ArgumentCaptor.forClass(byte[].class);
    verify(outputStore).write(eq(DESTINATION), content.capture(), anyString());
    return new String(content.getValue(), StandardCharsets.UTF_8);
  }

  @Test
  void run_shouldTranscribeTranslateAndWriteSubtitles() throws Exception {
    givenExtractedAudio(10.0);
    when(speechToText.transcribe(any()))
        .thenReturn(
            new Transcript(
                List.of(
                    new TranscriptSegment(0.0, 2.5, " Hello "),
                    new TranscriptSegment(3.0, 5.0, "Goodbye")),
                "Hello Goodbye",
                "en"));
    when(translationClient.translate(" Hello ", "km")).thenReturn("សួស្តី");
    when(translationClient.translate("Goodbye", "km")).thenReturn("លាហើយ");

    TranscriptionResult result = pipeline.run(context);

    String expected =
        "1\n00:00:00,000 --> 00:00:02,500\nសួស្តី\n\n"
            + "2\n00:00:03,000 --> 00:00:05,000\nលាហើយ\n\n";
    assertThat(result.subtitleText()).isEqualTo(expected);
    assertThat(writtenText()).isEqualTo(expected);
    assertThat(result.destination()).isEqualTo(DESTINATION);
    assertThat(result.fallbackCount()).isZero();
    assertThat(pipeline.state()).isEqualTo(PipelineState.DONE);
    assertThat(context.messages)
        .containsExactly(
            "Extracting audio from media...",
            "Audio extracted. Speech-to-text backend ready (whisper (base)).",
            "Transcribing audio...",
            "Transcribed 2 segments.",
            "Translating segments...",
            "Subtitle file saved to " + DESTINATION);
    assertThat(Files.exists(extractedFile)).isFalse();
  }

  @Test
  void run_shouldKeepSourceTextAndWarnWhenTranslationFails() throws Exception {
    givenExtractedAudio(10.0);
    when(speechToText.transcribe(any()))
        .thenReturn(
            new Transcript(
                List.of(
                    new TranscriptSegment(0.0, 1.0, "one"),
                    new TranscriptSegment(1.0, 2.0, "two")),
                "one two",
                "en"));
    when(translationClient.translate("one", "km")).thenReturn("មួយ");
    when(translationClient.translate("two", "km"))
        .thenThrow(new TranslationException("service unavailable"));

    TranscriptionResult result = pipeline.run(context);

    assertThat(result.segments()).extracting(Segment::text).containsExactly("មួយ", "two");
    assertThat(result.fallbackCount()).isEqualTo(1);
    assertThat(context.messages)
        .contains("Warning: Translation error for segment 2: service unavailable");
    assertThat(pipeline.state()).isEqualTo(PipelineState.DONE);
  }

  @Test
  void run_shouldKeepSourceTextWithoutWarningWhenTranslationIsBlank() throws Exception {
    givenExtractedAudio(10.0);
    when(speechToText.transcribe(any()))
        .thenReturn(
            new Transcript(List.of(new TranscriptSegment(0.0, 1.0, "one")), "one", "en"));
    when(translationClient.translate("one", "km")).thenReturn("  ");

    TranscriptionResult result = pipeline.run(context);

    assertThat(result.segments()).extracting(Segment::text).containsExactly("one");
    assertThat(result.fallbackCount()).isZero();
    assertThat(context.messages).noneMatch(m -> m.startsWith("Warning"));
  }

  @Test
  void run_shouldUseWholeTranscriptWhenNoTimedSegments() throws Exception {
    givenExtractedAudio(42.5);
    when(speechToText.transcribe(any()))
        .thenReturn(new Transcript(List.of(), "Everything said at once", "en"));
    when(translationClient.translate("Everything said at once", "km")).thenReturn("translated");

    TranscriptionResult result = pipeline.run(context);

    assertThat(result.segments()).containsExactly(new Segment(1, 0.0, 42.5, "translated"));
    assertThat(context.messages).contains("Transcribed 1 segments.");
    assertThat(writtenText()).startsWith("1\n00:00:00,000 --> 00:00:42,500\n");
  }

  @Test
  void run_shouldFailWithoutWritingWhenExtractionFails() {
    when(extractor.extract(MEDIA)).thenThrow(new ExternalServiceException("ffmpeg missing"));

    assertThatThrownBy(() -> pipeline.run(context))
        .isInstanceOf(ExternalServiceException.class)
        .hasMessage("ffmpeg missing");
    assertThat(pipeline.state()).isEqualTo(PipelineState.FAILED);
    verifyNoInteractions(outputStore, translationClient);
  }

  @Test
  void run_shouldDeleteExtractedAudioWhenTranscriptionFails() throws Exception {
    givenExtractedAudio(10.0);
    when(speechToText.transcribe(any())).thenThrow(new ExternalServiceException("whisper down"));

    assertThatThrownBy(() -> pipeline.run(context)).hasMessage("whisper down");
    assertThat(Files.exists(extractedFile)).isFalse();
    assertThat(pipeline.state()).isEqualTo(PipelineState.FAILED);
    verify(outputStore, never()).write(anyString(), any(), anyString());
  }

  @Test
  void run_shouldFailWhenSubtitleCannotBeWritten() throws Exception {
    givenExtractedAudio(10.0);
    when(speechToText.transcribe(any()))
        .thenReturn(new Transcript(List.of(new TranscriptSegment(0, 1, "x")), "x", "en"));
    when(translationClient.translate("x", "km")).thenReturn("y");
    doThrow(new ResourceException("disk full"))
        .when(outputStore)
        .write(eq(DESTINATION), any(), anyString());

    assertThatThrownBy(() -> pipeline.run(context))
        .isInstanceOf(ResourceException.class)
        .hasMessage("disk full");
    assertThat(pipeline.state()).isEqualTo(PipelineState.FAILED);
    assertThat(context.messages).noneMatch(m -> m.startsWith("Subtitle file saved"));
  }

  @Test
  void run_shouldStopBetweenSegmentsWhenCancelled() throws Exception {
    givenExtractedAudio(10.0);
    when(speechToText.transcribe(any()))
        .thenReturn(
            new Transcript(
                List.of(new TranscriptSegment(0, 1, "a"), new TranscriptSegment(1, 2, "b")),
                "a b",
                "en"));
    when(translationClient.translate("a", "km"))
        .thenAnswer(
            invocation -> {
              context.cancel();
              return "A";
            });

    assertThatThrownBy(() -> pipeline.run(context)).isInstanceOf(TaskCancelledException.class);
    verify(translationClient, never()).translate("b", "km");
    verifyNoInteractions(outputStore);
    assertThat(pipeline.state()).isEqualTo(PipelineState.FAILED);
  }

  @Test
  void run_shouldRefuseSecondRun() throws Exception {
    givenExtractedAudio(1.0);
    when(speechToText.transcribe(any())).thenReturn(new Transcript(List.of(), "", "en"));

    pipeline.run(context);

    assertThatThrownBy(() -> pipeline.run(context)).isInstanceOf(IllegalStateException.class);
  }
}
