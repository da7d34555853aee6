package com.flamingo.ai.chartreader.service.storage;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.tika.Tika;

/** Naming rules for uploaded chart documents. */
public final class FileNames {

  public static final Set<String> SUPPORTED_EXTENSIONS =
      Set.of("jpg", "jpeg", "png", "webp", "pdf");

  public static final String MISSING_DATE_MESSAGE =
      "Date not found in filename (expected YYYY-MM-DD)";

  private static final Pattern UNSAFE_CHARS = Pattern.compile("[^a-zA-Z0-9._-]+");
  private static final Pattern ENTRY_DATE = Pattern.compile("(\\d{4}-\\d{2}-\\d{2})");
  private static final int MAX_SUFFIX = 10_000;
  private static final Tika TIKA = new Tika();

  private FileNames() {}

  /** Strips any directory part and replaces runs of unsafe characters with an underscore. */
  public static String sanitize(String originalName) {
    if (originalName == null) {
      return "upload";
    }
    String base = originalName.replace('\\', '/');
    base = base.substring(base.lastIndexOf('/') + 1).trim();
    if (base.isEmpty()) {
      return "upload";
    }
    String sanitized = UNSAFE_CHARS.matcher(base).replaceAll("_");
    return sanitized.isEmpty() ? "upload" : sanitized;
  }

  /**
   * Returns the sanitized name, or the first free {@code base_N.ext} variant.
   *
   * @throws IllegalStateException when every suffix is taken
   */
  public static String makeUnique(String desiredName, Predicate<String> isTaken) {
    String sanitized = sanitize(desiredName);
    if (!isTaken.test(sanitized)) {
      return sanitized;
    }
    int dot = sanitized.lastIndexOf('.');
    String base = dot > 0 ? sanitized.substring(0, dot) : sanitized;
    String ext = dot > 0 ? sanitized.substring(dot) : "";
    for (int i = 1; i < MAX_SUFFIX; i++) {
      String candidate = base + "_" + i + ext;
      if (!isTaken.test(candidate)) {
        return candidate;
      }
    }
    throw new IllegalStateException("Unable to find a unique filename for " + sanitized);
  }

  /** First {@code YYYY-MM-DD} in the name, when it is a real calendar date. */
  public static Optional<LocalDate> parseEntryDate(String filename) {
    if (filename == null) {
      return Optional.empty();
    }
    Matcher matcher = ENTRY_DATE.matcher(filename);
    if (!matcher.find()) {
      return Optional.empty();
    }
    try {
      return Optional.of(LocalDate.parse(matcher.group(1)));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  public static String extension(String filename) {
    int dot = filename.lastIndexOf('.');
    return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  public static boolean isSupported(String filename) {
    return SUPPORTED_EXTENSIONS.contains(extension(filename));
  }

  public static boolean isPdf(String filename) {
    return "pdf".equals(extension(filename));
  }

  /** MIME type from the file name, or {@code application/octet-stream} when unknown. */
  public static String mimeType(String filename) {
    return TIKA.detect(filename);
  }
}
