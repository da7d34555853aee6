package com.flamingo.ai.chartreader.service.export;

/**
 * @param updatedAt ISO-8601 time the file was written
 * @param totalRowCount data rows in the file, header excluded
 */
public record CsvExportResult(String updatedAt, long totalRowCount) {}
