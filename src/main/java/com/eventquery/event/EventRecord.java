package com.eventquery.event;

import java.time.Instant;

/**
 * 待写入事件表的一行事件，{@code metadata} 为 JSON 文本，可为空。
 */
public record EventRecord(
        Instant timestamp,
        String message,
        String severity,
        String source,
        String deviceId,
        String category,
        String metadata
) {
    public static EventRecord of(Instant timestamp, String message, String severity, String source) {
        return new EventRecord(timestamp, message, severity, source, null, null, null);
    }
}
