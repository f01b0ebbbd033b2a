package com.scholary.subtitle.media;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.subtitle.config.EngineProperties;
import com.scholary.subtitle.exception.ExternalServiceException;
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
class FfmpegAudioExtractorTest {

  @Mock private ProcessRunner processRunner;

  @TempDir Path tempDir;

  private FfmpegAudioExtractor extractor;

  @BeforeEach
  void setUp() {
    extractor =
        new FfmpegAudioExtractor(
            new FfmpegProperties("ffmpeg", "ffprobe", 60, 16000, 4),
            processRunner,
            new EngineProperties(tempDir.toString(), 24000, 1, 3600, 1, 1));
  }

  @Test
  void extract_shouldProduceMonoWavAndProbeDuration() throws Exception {
    when(processRunner.run(anyList(), eq("ffmpeg extract"), any()))
        .thenReturn(new ProcessRunner.Result(0, ""));
    when(processRunner.run(anyList(), eq("ffprobe"), any()))
        .thenReturn(new ProcessRunner.Result(0, "12.480000\n"));

    Path extractedPath;
    try (ExtractedAudio audio = extractor.extract("/media/clip.mp4")) {
      extractedPath = audio.path();
      assertThat(audio.durationSeconds()).isEqualTo(12.48);
      assertThat(extractedPath).exists().hasParent(tempDir);
    }
    assertThat(extractedPath).doesNotExist();

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<String>> command = ArgumentCaptor.forClass(List.class);
    verify(processRunner).run(command.capture(), eq("ffmpeg extract"), any());
    assertThat(command.getValue())
        .containsSubsequence("-i", "/media/clip.mp4")
        .containsSubsequence("-ac", "1")
        .containsSubsequence("-ar", "16000")
        .contains("-vn");
  }

  @Test
  void extract_shouldFailAndCleanUpWhenFfmpegFails() throws Exception {
    when(processRunner.run(anyList(), eq("ffmpeg extract"), any()))
        .thenReturn(new ProcessRunner.Result(1, "No such file or directory"));

    assertThatThrownBy(() -> extractor.extract("/media/missing.mp4"))
        .isInstanceOf(ExternalServiceException.class)
        .hasMessageContaining("No such file");
    verify(processRunner, never()).run(anyList(), eq("ffprobe"), any());
    try (var files = Files.list(tempDir)) {
      assertThat(files).isEmpty();
    }
  }

  @Test
  void extract_shouldFailAndCleanUpWhenDurationIsUnreadable() throws Exception {
    when(processRunner.run(anyList(), eq("ffmpeg extract"), any()))
        .thenReturn(new ProcessRunner.Result(0, ""));
    when(processRunner.run(anyList(), eq("ffprobe"), any()))
        .thenReturn(new ProcessRunner.Result(0, "N/A\n"));

    assertThatThrownBy(() -> extractor.extract("/media/clip.mp4"))
        .isInstanceOf(ExternalServiceException.class);
    try (var files = Files.list(tempDir)) {
      assertThat(files).isEmpty();
    }
  }
}
