package com.twos.common;

import java.util.UUID;
import org.slf4j.MDC;

public final class TraceIds {
  private static final String MDC_TRACE_ID = "trace_id";
  private static final String MDC_LEGACY_TRACE_ID = "traceId";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  // MDC に trace_id が無い場合 (スケジューラ起点など) は新規に採番する
  public static String currentOrNew() {
    final String traceId = MDC.get(MDC_TRACE_ID);
    if (traceId != null && !traceId.isBlank()) {
      return traceId;
    }
    final String legacyTraceId = MDC.get(MDC_LEGACY_TRACE_ID);
    if (legacyTraceId != null && !legacyTraceId.isBlank()) {
      return legacyTraceId;
    }
    return newTraceId();
  }
}
