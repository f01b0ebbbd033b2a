package com.scholary.subtitle.translation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SegmentTranslatorTest {

  @Mock private TranslationClient client;

  private SegmentTranslator translator;

  @BeforeEach
  void setUp() {
    translator = new SegmentTranslator(client);
  }

  @Test
  void translate_shouldReturnTranslation() throws Exception {
    when(client.translate("Hello", "km")).thenReturn("សួស្តី");

    TranslationOutcome outcome = translator.translate("Hello", "km");

    assertThat(outcome.text()).isEqualTo("សួស្តី");
    assertThat(outcome.translated()).isTrue();
    assertThat(outcome.hasWarning()).isFalse();
  }

  @Test
  void translate_shouldKeepSourceTextOnFailure() throws Exception {
    when(client.translate("Hello", "km")).thenThrow(new TranslationException("timeout"));

    TranslationOutcome outcome = translator.translate("Hello", "km");

    assertThat(outcome.text()).isEqualTo("Hello");
    assertThat(outcome.translated()).isFalse();
    assertThat(outcome.warning()).isEqualTo("timeout");
  }

  @Test
  void translate_shouldKeepSourceTextSilentlyWhenResultIsEmpty() throws Exception {
    when(client.translate("Hello", "km")).thenReturn("");

    TranslationOutcome outcome = translator.translate("Hello", "km");

    assertThat(outcome).isEqualTo(TranslationOutcome.untouched("Hello"));
  }
}
