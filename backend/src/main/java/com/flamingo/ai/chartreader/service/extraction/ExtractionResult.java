package com.flamingo.ai.chartreader.service.extraction;

import java.util.List;

/**
 * Normalized rows of one extraction call.
 *
 * @param rows rows with every required field present
 * @param rawResponseJson audit payload: the normalized rows, token usage and the model's raw text
 */
public record ExtractionResult(List<ExtractedRow> rows, String rawResponseJson) {}
