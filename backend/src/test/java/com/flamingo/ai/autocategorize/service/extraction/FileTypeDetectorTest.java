package com.flamingo.ai.autocategorize.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.autocategorize.domain.enums.FileType;
import com.flamingo.ai.autocategorize.exception.UnsupportedFileTypeException;
import com.flamingo.ai.autocategorize.support.TestImages;
import java.awt.Color;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link FileTypeDetector}. */
class FileTypeDetectorTest {

  private final FileTypeDetector detector = new FileTypeDetector();

  @Test
  void shouldDetectImage_fromMagicBytes() {
    byte[] png = TestImages.solidPng(4, 4, Color.RED);

    assertThat(detector.detect(new SourceFile("upload.bin", png))).isEqualTo(FileType.IMAGE);
  }

  @Test
  void shouldDetectPdf() {
    byte[] pdf = "%PDF-1.4\n%âãÏÓ\n1 0 obj\n<<>>\nendobj\n".getBytes(StandardCharsets.ISO_8859_1);

    assertThat(detector.detect(new SourceFile("doc.pdf", pdf))).isEqualTo(FileType.PDF);
  }

  @Test
  void shouldDetectJson_fromExtension() {
    byte[] json = "{\"a\":1}".getBytes(StandardCharsets.UTF_8);

    assertThat(detector.detect(new SourceFile("data.json", json))).isEqualTo(FileType.JSON);
  }

  @Test
  void shouldDetectWaveAudio() {
    byte[] wav = new byte[44];
    System.arraycopy("RIFF".getBytes(StandardCharsets.US_ASCII), 0, wav, 0, 4);
    System.arraycopy("WAVEfmt ".getBytes(StandardCharsets.US_ASCII), 0, wav, 8, 8);

    assertThat(detector.detect(new SourceFile("memo.wav", wav))).isEqualTo(FileType.AUDIO);
  }

  @Test
  void shouldRejectPlainText() {
    byte[] text = "just some notes".getBytes(StandardCharsets.UTF_8);

    assertThatThrownBy(() -> detector.detect(new SourceFile("notes.txt", text)))
        .isInstanceOf(UnsupportedFileTypeException.class)
        .hasMessageContaining("text/plain");
  }
}
