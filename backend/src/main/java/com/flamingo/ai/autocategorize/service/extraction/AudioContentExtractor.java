package com.flamingo.ai.autocategorize.service.extraction;

import com.flamingo.ai.autocategorize.domain.enums.FileType;
import com.flamingo.ai.autocategorize.domain.model.AudioContent;
import com.flamingo.ai.autocategorize.service.extraction.speech.AudioEncoding;
import com.flamingo.ai.autocategorize.service.extraction.speech.SpeechClient;
import com.flamingo.ai.autocategorize.service.extraction.speech.Transcription;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Transcribes audio files into timed words. */
@Component
@RequiredArgsConstructor
@Slf4j
public class AudioContentExtractor implements ContentExtractor {

  private final SpeechClient speechClient;

  @Override
  public boolean supports(FileType fileType) {
    return fileType == FileType.AUDIO;
  }

  @Override
  public ExtractedContent extract(SourceFile file) {
    AudioEncoding encoding = AudioEncoding.fromExtension(file.extension());
    Transcription transcription = speechClient.transcribe(file.bytes(), encoding);
    log.debug(
        "Transcribed {} as {}: {} words, speech {}",
        file.name(),
        encoding,
        transcription.words().size(),
        transcription.status());

    List<String> degraded =
        transcription.status() == ProviderStatus.FAILED ? List.of("speech") : List.of();
    return new ExtractedContent(new AudioContent(transcription.words()), degraded);
  }
}
