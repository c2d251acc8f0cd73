package com.flamingo.ai.autocategorize.service.extraction.speech;

/** Speech-to-text provider with word time offsets. */
public interface SpeechClient {

  /**
   * Transcribes a recording. Provider failures yield {@link Transcription#failed()} rather than an
   * exception.
   */
  Transcription transcribe(byte[] audioBytes, AudioEncoding encoding);
}
