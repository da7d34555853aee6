package com.flamingo.ai.chartreader.service.pdf;

import java.util.List;

/**
 * Result of a candidate scan over a PDF.
 *
 * @param pageCount total pages in the document
 * @param pages candidate page numbers, best first
 */
public record PageCandidates(int pageCount, List<Integer> pages) {}
