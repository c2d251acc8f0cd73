package com.flamingo.ai.autocategorize.service.matching;

import com.flamingo.ai.autocategorize.domain.enums.MatchType;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/** Fuzzy keyword scoring used for document text. All comparisons ignore case. */
public final class TextSimilarity {

  static final double VERBATIM_CONFIDENCE = 0.9;
  static final double MAX_FUZZY_CONFIDENCE = 0.8;
  static final double PARTIAL_THRESHOLD = 0.3;

  private static final double FUZZY_WORD_THRESHOLD = 0.7;
  private static final double FUZZY_WORD_PENALTY = 0.8;

  private TextSimilarity() {}

  /**
   * Scores how well {@code keyword} is represented in {@code text}.
   *
   * <p>A verbatim occurrence scores 0.9. Otherwise every keyword word longer than two characters is
   * matched against the words of the text and the result combines coverage (share of keyword words
   * matched) and the mean best score of the matched words, capped at 0.8.
   *
   * @return confidence in [0, 0.9]; 0 when nothing matched or the keyword has no usable words
   */
  public static double keywordConfidence(String text, String keyword) {
    if (text == null || keyword == null || keyword.isBlank()) {
      return 0.0;
    }
    String textLower = text.toLowerCase(Locale.ROOT);
    String keywordLower = keyword.toLowerCase(Locale.ROOT);
    if (textLower.contains(keywordLower)) {
      return VERBATIM_CONFIDENCE;
    }

    List<String> keywordWords =
        words(keywordLower).stream().filter(word -> word.length() > 2).toList();
    if (keywordWords.isEmpty()) {
      return 0.0;
    }
    List<String> textWords = words(textLower);

    int matched = 0;
    double scoreSum = 0;
    for (String keywordWord : keywordWords) {
      double best = bestWordScore(keywordWord, textWords);
      if (best > 0) {
        matched++;
        scoreSum += best;
      }
    }
    if (matched == 0) {
      return 0.0;
    }
    double coverage = (double) matched / keywordWords.size();
    double average = scoreSum / matched;
    return Math.min(MAX_FUZZY_CONFIDENCE, coverage * 0.6 + average * 0.4);
  }

  /**
   * Classifies a keyword match: exact when the keyword occurs verbatim, partial when the fuzzy
   * confidence exceeds 0.3, keyword otherwise.
   */
  public static MatchType classify(String text, String keyword, double confidence) {
    if (text != null
        && keyword != null
        && text.toLowerCase(Locale.ROOT).contains(keyword.toLowerCase(Locale.ROOT))) {
      return MatchType.EXACT;
    }
    return confidence > PARTIAL_THRESHOLD ? MatchType.PARTIAL : MatchType.KEYWORD;
  }

  /**
   * Positional character similarity: characters equal at the same index divided by the longer
   * length.
   *
   * @return similarity in [0, 1]; 0 when the lengths differ by more than half of the longer word
   */
  public static double wordSimilarity(String a, String b) {
    int longer = Math.max(a.length(), b.length());
    if (longer == 0) {
      return 0.0;
    }
    if (Math.abs(a.length() - b.length()) > longer * 0.5) {
      return 0.0;
    }
    int common = 0;
    int shorter = Math.min(a.length(), b.length());
    for (int i = 0; i < shorter; i++) {
      if (a.charAt(i) == b.charAt(i)) {
        common++;
      }
    }
    return (double) common / longer;
  }

  /** Shorter length over longer length; 0 when either string is empty. */
  public static double lengthRatio(String a, String b) {
    int longer = Math.max(a.length(), b.length());
    if (longer == 0) {
      return 0.0;
    }
    return (double) Math.min(a.length(), b.length()) / longer;
  }

  /** True when both strings are non-empty and one contains the other. */
  public static boolean mutuallyContains(String a, String b) {
    if (a.isEmpty() || b.isEmpty()) {
      return false;
    }
    return a.contains(b) || b.contains(a);
  }

  private static double bestWordScore(String keywordWord, List<String> textWords) {
    double best = 0;
    for (String textWord : textWords) {
      if (textWord.equals(keywordWord)) {
        return 1.0;
      }
      if (mutuallyContains(textWord, keywordWord)) {
        best = Math.max(best, lengthRatio(textWord, keywordWord));
      } else if (keywordWord.length() > 3 && textWord.length() > 3) {
        double similarity = wordSimilarity(keywordWord, textWord);
        if (similarity > FUZZY_WORD_THRESHOLD) {
          best = Math.max(best, similarity * FUZZY_WORD_PENALTY);
        }
      }
    }
    return best;
  }

  private static List<String> words(String text) {
    String trimmed = text.trim();
    if (trimmed.isEmpty()) {
      return List.of();
    }
    return Arrays.asList(trimmed.split("\\s+"));
  }
}
