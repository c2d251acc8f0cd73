package com.flamingo.ai.autocategorize.service.matching;

import com.flamingo.ai.autocategorize.domain.enums.EvidenceKind;
import com.flamingo.ai.autocategorize.domain.enums.FileType;
import com.flamingo.ai.autocategorize.domain.enums.MatchType;
import com.flamingo.ai.autocategorize.domain.model.AnalysisRequest;
import com.flamingo.ai.autocategorize.domain.model.AudioContent;
import com.flamingo.ai.autocategorize.domain.model.AudioSegmentPattern;
import com.flamingo.ai.autocategorize.domain.model.MatchCandidate;
import com.flamingo.ai.autocategorize.domain.model.TranscriptWord;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Matches stored audio segments against the transcript of the candidate recording.
 *
 * <p>The segment text is looked up first, then its keyword. Start and end times on the candidate
 * are those stored with the segment, not positions in the new recording.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AudioSegmentMatcher implements ModalityMatcher {

  static final double TEXT_CONFIDENCE = 0.95;
  static final double KEYWORD_CONFIDENCE = 0.9;
  static final int SNIPPET_CONTEXT = 50;

  private final CorpusScanner scanner;

  @Override
  public boolean supports(FileType fileType) {
    return fileType == FileType.AUDIO;
  }

  @Override
  public MatchOutcome match(AnalysisRequest request) {
    AudioContent content = (AudioContent) request.content();
    Map<String, Object> diagnostics = speechDiagnostics(content.words());

    if (content.isEmpty()) {
      log.info("Empty transcript, skipping segment matching");
      return MatchOutcome.empty(diagnostics);
    }
    String transcript = content.transcript();
    String lower = transcript.toLowerCase(Locale.ROOT);
    diagnostics.put("transcriptLength", transcript.length());

    List<MatchCandidate> candidates =
        scanner.scan(
            request.corpus(),
            AudioSegmentPattern.class,
            request.directory(),
            (pattern, category) -> score(pattern, category, transcript, lower));
    return new MatchOutcome(candidates, diagnostics);
  }

  private Optional<MatchCandidate> score(
      AudioSegmentPattern pattern, String category, String transcript, String lower) {
    Optional<MatchCandidate> byText =
        find(pattern, category, pattern.text(), transcript, lower)
            .map(
                builder ->
                    builder.confidence(TEXT_CONFIDENCE).matchType(MatchType.TRANSCRIPT_TEXT))
            .map(MatchCandidate.MatchCandidateBuilder::build);
    if (byText.isPresent()) {
      return byText;
    }
    return find(pattern, category, pattern.keywordText(), transcript, lower)
        .map(
            builder ->
                builder.confidence(KEYWORD_CONFIDENCE).matchType(MatchType.TRANSCRIPT_KEYWORD))
        .map(MatchCandidate.MatchCandidateBuilder::build);
  }

  private Optional<MatchCandidate.MatchCandidateBuilder> find(
      AudioSegmentPattern pattern,
      String category,
      String needle,
      String transcript,
      String lower) {
    if (needle == null || needle.isBlank()) {
      return Optional.empty();
    }
    String lowerNeedle = needle.toLowerCase(Locale.ROOT);
    int index = lower.indexOf(lowerNeedle);
    if (index < 0) {
      return Optional.empty();
    }
    return Optional.of(
        MatchCandidate.builder()
            .patternRef(pattern.id())
            .category(category)
            .evidenceKind(EvidenceKind.AUDIO_SEGMENT)
            .text(needle)
            .snippet(snippet(transcript, index, lowerNeedle.length()))
            .startTime(pattern.startTime())
            .endTime(pattern.endTime()));
  }

  static String snippet(String transcript, int index, int length) {
    int start = Math.max(0, Math.min(transcript.length(), index - SNIPPET_CONTEXT));
    int end = Math.min(transcript.length(), index + length + SNIPPET_CONTEXT);
    return transcript.substring(start, Math.max(start, end));
  }

  static Map<String, Object> speechDiagnostics(List<TranscriptWord> words) {
    Map<String, Object> diagnostics = new LinkedHashMap<>();
    int count = words.size();
    double duration = count > 0 ? words.get(count - 1).endTime() : 0.0;
    Set<String> unique = new HashSet<>();
    double wordDurationSum = 0;
    for (TranscriptWord word : words) {
      unique.add(word.word().toLowerCase(Locale.ROOT));
      wordDurationSum += word.duration();
    }
    diagnostics.put("duration", duration);
    diagnostics.put("wordCount", count);
    diagnostics.put("speechRate", duration > 0 ? count / (duration / 60.0) : 0.0);
    diagnostics.put("uniqueWords", unique.size());
    diagnostics.put("vocabularyDiversity", count > 0 ? (double) unique.size() / count : 0.0);
    diagnostics.put("averageWordDuration", count > 0 ? wordDurationSum / count : 0.0);
    return diagnostics;
  }
}
