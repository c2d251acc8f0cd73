package com.flamingo.ai.autocategorize.service.extraction.speech;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Used when no speech provider is configured; audio files stay uncategorized. */
@Component
@ConditionalOnProperty(
    name = "categorization.speech.enabled",
    havingValue = "false",
    matchIfMissing = true)
@Slf4j
public class DisabledSpeechClient implements SpeechClient {

  public DisabledSpeechClient() {
    log.info("Speech provider disabled, audio files cannot be transcribed");
  }

  @Override
  public Transcription transcribe(byte[] audioBytes, AudioEncoding encoding) {
    return Transcription.disabled();
  }
}
