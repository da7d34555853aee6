package com.flamingo.ai.chartreader.service.pdf;

/**
 * Requested render resolution plus the size limits that may lower it.
 *
 * @param dpi requested resolution
 * @param maxDimension longest allowed side in pixels
 * @param maxPixels largest allowed pixel count
 */
public record RenderBounds(float dpi, int maxDimension, long maxPixels) {

  private static final float POINTS_PER_INCH = 72f;

  /** Resolution to render a page of the given size in points at, honoring both limits. */
  public float effectiveDpi(float widthPoints, float heightPoints) {
    double scale = dpi / POINTS_PER_INCH;
    double width = Math.max(1, Math.ceil(widthPoints * scale));
    double height = Math.max(1, Math.ceil(heightPoints * scale));
    double dimensionScale = Math.min(1, Math.min(maxDimension / width, maxDimension / height));
    double pixelScale = Math.min(1, Math.sqrt(maxPixels / (width * height)));
    double downscale = Math.min(dimensionScale, pixelScale);
    return (float) Math.max(1, dpi * downscale);
  }
}
