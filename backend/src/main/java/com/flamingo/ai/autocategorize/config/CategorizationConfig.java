package com.flamingo.ai.autocategorize.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the categorization engine and its collaborators. */
@Configuration
@ConfigurationProperties(prefix = "categorization")
@Getter
@Setter
public class CategorizationConfig {

  private Corpus corpus = new Corpus();
  private Scan scan = new Scan();
  private Image image = new Image();
  private Pdf pdf = new Pdf();
  private Aggregation aggregation = new Aggregation();
  private Vision vision = new Vision();
  private Speech speech = new Speech();

  /** Locations of the file-backed collaborators. */
  @Getter
  @Setter
  public static class Corpus {
    /** JSON array of annotation records. */
    private String annotationsPath = "data/annotations.json";

    /** JSON array of {@code {id, name}} categories. */
    private String categoriesPath = "data/categories.json";

    /** JSON index of previously categorised images and their visual matches. */
    private String referenceImagesPath = "data/reference-images.json";

    /** Directory that relative image paths in the reference index are resolved against. */
    private String referenceImagesBaseDir = "data";
  }

  /** Corpus scan fan-out. */
  @Getter
  @Setter
  public static class Scan {
    private int corePoolSize = 4;
    private int maxPoolSize = 8;
    private int queueCapacity = 500;

    /** Patterns per task submitted to the scan executor. */
    private int batchSize = 64;

    /** Below this many patterns the scan runs on the calling thread. */
    private int parallelThreshold = 128;
  }

  @Getter
  @Setter
  public static class Image {
    /** Confidence of an OCR region match. */
    private double textMatchConfidence = 0.8;

    /** Whole-image similarity needed to propagate a reference image's visual matches. */
    private double propagationThreshold = 0.7;

    /** Upper bound for propagated confidence. */
    private double propagationMaxConfidence = 0.9;

    /** Crops must be larger than this on both sides to be analysed. */
    private int minCropSide = 10;

    /** Minimum annotated area assumed to be a visual element when cropping fails. */
    private double fallbackMinArea = 1000;

    private double fallbackConfidence = 0.4;

    /** Thresholds used when an object/logo detector answered for the image. */
    private VisualThresholds withDetector = new VisualThresholds(50, 20, 0.1, 500, 0.7);

    /** Thresholds used from pixel features alone. */
    private VisualThresholds pixelsOnly = new VisualThresholds(30, 15, 0.05, 300, 0.6);
  }

  /** Pixel-feature thresholds deciding whether a cropped region holds a visual element. */
  @Getter
  @Setter
  public static class VisualThresholds {
    private double texture;
    private double edges;
    private double histogramPeak;
    private double minArea;
    private double confidence;

    public VisualThresholds() {}

    public VisualThresholds(
        double texture, double edges, double histogramPeak, double minArea, double confidence) {
      this.texture = texture;
      this.edges = edges;
      this.histogramPeak = histogramPeak;
      this.minArea = minArea;
      this.confidence = confidence;
    }
  }

  @Getter
  @Setter
  public static class Pdf {
    /** Keyword confidence a pattern must exceed to become a candidate. */
    private double acceptanceThreshold = 0.1;

    /** Below this many characters the PDF is probably scanned and a warning is logged. */
    private int lowTextWarningChars = 50;
  }

  @Getter
  @Setter
  public static class Aggregation {
    /**
     * Which candidates the reported confidence is taken from: {@code global} (every candidate,
     * default) or {@code winner} (only the winning category's candidates).
     */
    private ConfidenceScope confidenceScope = ConfidenceScope.GLOBAL;
  }

  public enum ConfidenceScope {
    GLOBAL,
    WINNER
  }

  /** Google Cloud Vision REST endpoint used for OCR and object/logo localisation. */
  @Getter
  @Setter
  public static class Vision {
    private boolean enabled = false;
    private String baseUrl = "https://vision.googleapis.com";
    private String apiKey = "";
    private int maxTextResults = 50;
    private int readTimeoutMs = 15000;
  }

  /** Google Cloud Speech-to-Text REST endpoint used for transcription. */
  @Getter
  @Setter
  public static class Speech {
    private boolean enabled = false;
    private String baseUrl = "https://speech.googleapis.com";
    private String apiKey = "";
    private String languageCode = "en-US";

    /** Sample rate sent to the API; 0 lets the provider read it from the file header. */
    private int sampleRateHertz = 0;
    private int readTimeoutMs = 60000;
  }
}
