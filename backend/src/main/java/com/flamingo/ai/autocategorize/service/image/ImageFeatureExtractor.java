package com.flamingo.ai.autocategorize.service.image;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import javax.imageio.ImageIO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Extracts comparable pixel features from an image.
 *
 * <p>Every image is first drawn onto a 64x64 RGB canvas with bilinear interpolation, which drops
 * the alpha channel and makes features of differently sized images comparable.
 */
@Component
@Slf4j
public class ImageFeatureExtractor {

  public static final int CANONICAL_SIZE = 64;

  /**
   * Decodes and analyses an encoded image.
   *
   * @param imageBytes encoded image (PNG, JPEG, GIF, BMP, ...)
   * @return extracted features
   * @throws IOException if the bytes cannot be decoded as an image
   */
  public ImageFeatures extractFeatures(byte[] imageBytes) throws IOException {
    return extractFeatures(decode(imageBytes));
  }

  /** Analyses an already decoded image, for example a crop of a larger one. */
  public ImageFeatures extractFeatures(BufferedImage image) {
    int[][] rgb = normalise(image);
    int pixels = CANONICAL_SIZE * CANONICAL_SIZE;

    double brightnessSum = 0;
    double rSum = 0;
    double gSum = 0;
    double bSum = 0;
    double[] histogram = new double[ImageFeatures.HISTOGRAM_BINS];
    double[][] brightness = new double[CANONICAL_SIZE][CANONICAL_SIZE];

    for (int y = 0; y < CANONICAL_SIZE; y++) {
      for (int x = 0; x < CANONICAL_SIZE; x++) {
        int pixel = rgb[y][x];
        int r = red(pixel);
        int g = green(pixel);
        int b = blue(pixel);
        double mean = (r + g + b) / 3.0;
        brightness[y][x] = mean;
        brightnessSum += mean;
        rSum += r;
        gSum += g;
        bSum += b;
        histogram[(int) Math.round(mean)]++;
      }
    }
    for (int i = 0; i < histogram.length; i++) {
      histogram[i] /= pixels;
    }

    return new ImageFeatures(
        brightnessSum / pixels,
        new RgbColor(rSum / pixels, gSum / pixels, bSum / pixels),
        edgeDensity(rgb, pixels),
        textureComplexity(brightness, pixels),
        histogram);
  }

  /**
   * Decodes encoded image bytes.
   *
   * @throws IOException if no installed reader understands the bytes
   */
  public BufferedImage decode(byte[] imageBytes) throws IOException {
    if (imageBytes == null || imageBytes.length == 0) {
      throw new IOException("Empty image buffer");
    }
    BufferedImage image = ImageIO.read(new ByteArrayInputStream(imageBytes));
    if (image == null) {
      throw new IOException("Unsupported or corrupt image data (" + imageBytes.length + " bytes)");
    }
    return image;
  }

  private int[][] normalise(BufferedImage source) {
    BufferedImage canvas =
        new BufferedImage(CANONICAL_SIZE, CANONICAL_SIZE, BufferedImage.TYPE_INT_RGB);
    Graphics2D graphics = canvas.createGraphics();
    try {
      graphics.setRenderingHint(
          RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
      graphics.drawImage(source, 0, 0, CANONICAL_SIZE, CANONICAL_SIZE, null);
    } finally {
      graphics.dispose();
    }

    int[][] rgb = new int[CANONICAL_SIZE][CANONICAL_SIZE];
    for (int y = 0; y < CANONICAL_SIZE; y++) {
      for (int x = 0; x < CANONICAL_SIZE; x++) {
        rgb[y][x] = canvas.getRGB(x, y);
      }
    }
    return rgb;
  }

  // Gradient on the red channel only
  private double edgeDensity(int[][] rgb, int pixels) {
    double sum = 0;
    for (int y = 1; y < CANONICAL_SIZE - 1; y++) {
      for (int x = 1; x < CANONICAL_SIZE - 1; x++) {
        int gx = Math.abs(red(rgb[y][x + 1]) - red(rgb[y][x - 1]));
        int gy = Math.abs(red(rgb[y + 1][x]) - red(rgb[y - 1][x]));
        sum += Math.sqrt((double) gx * gx + (double) gy * gy);
      }
    }
    return sum / pixels;
  }

  private double textureComplexity(double[][] brightness, int pixels) {
    double sum = 0;
    for (int y = 1; y < CANONICAL_SIZE - 1; y++) {
      for (int x = 1; x < CANONICAL_SIZE - 1; x++) {
        double center = brightness[y][x];
        double diff = 0;
        for (int dy = -1; dy <= 1; dy++) {
          for (int dx = -1; dx <= 1; dx++) {
            if (dx != 0 || dy != 0) {
              diff += Math.abs(center - brightness[y + dy][x + dx]);
            }
          }
        }
        sum += diff / 8.0;
      }
    }
    return sum / pixels;
  }

  private static int red(int pixel) {
    return (pixel >> 16) & 0xFF;
  }

  private static int green(int pixel) {
    return (pixel >> 8) & 0xFF;
  }

  private static int blue(int pixel) {
    return pixel & 0xFF;
  }
}
