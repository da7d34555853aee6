package com.flamingo.ai.chartreader.service.extraction;

import java.util.Base64;

/**
 * Image bytes sent to the extraction model.
 *
 * @param data encoded image
 * @param mimeType MIME type of {@code data}
 */
public record ModelImage(byte[] data, String mimeType) {

  public String base64() {
    return Base64.getEncoder().encodeToString(data);
  }
}
