package com.flamingo.ai.chartreader.service.event;

/**
 * A change observers may want to react to.
 *
 * @param type one of the {@code TYPE_*} constants, used as the SSE event name
 * @param payload event body; a {@code Job} for {@link #TYPE_JOB}
 */
public record JobEvent(String type, Object payload) {

  public static final String TYPE_STATE = "state";
  public static final String TYPE_JOB = "job";
  public static final String TYPE_SETTINGS = "settings";
  public static final String TYPE_CSV_UPDATED = "csv_updated";
  public static final String TYPE_CSV_ERROR = "csv_error";
}
