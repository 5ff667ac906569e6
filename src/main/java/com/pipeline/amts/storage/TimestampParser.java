package com.pipeline.amts.storage;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.zone.ZoneOffsetTransition;
import java.time.zone.ZoneRules;
import java.util.List;

/**
 * 原始文件与配置表中时间字符串的解析。
 *
 * 本地时间按指定时区换算为UTC：
 * - 夏令时跳变缺口中的时间前移到跳变时刻
 * - 夏令时回拨重叠的时间有歧义，视为无法解析
 */
public final class TimestampParser {

    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss[.SSS]"),
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("M/d/yyyy H:mm[:ss]")
    );

    private TimestampParser() {}

    /**
     * 解析时间字符串。带时区偏移的字符串直接换算，否则按 zone 解释。
     *
     * @param raw    时间字符串
     * @param zone   本地时间所在时区
     * @param format 指定格式；为null时依次尝试内置格式
     * @return UTC时刻
     * @throws DateTimeException 无法解析或时间有歧义
     */
    public static Instant toInstant(String raw, ZoneId zone, DateTimeFormatter format) {
        if (raw == null || raw.isBlank()) {
            throw new DateTimeException("Empty timestamp");
        }
        String text = raw.trim();

        if (format == null) {
            try {
                return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
            } catch (DateTimeParseException ignored) {
                // 不带偏移，继续按本地时间解析
            }
        }
        return localToInstant(parseLocal(text, format), zone);
    }

    /**
     * 解析配置表中的UTC时间，额外接受只有日期的写法（当天零点）。
     */
    public static Instant parseUtc(String raw) {
        if (raw != null && raw.trim().length() == 10) {
            try {
                return LocalDate.parse(raw.trim()).atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeParseException ignored) {
                // 交给通用解析
            }
        }
        return toInstant(raw, ZoneOffset.UTC, null);
    }

    static LocalDateTime parseLocal(String text, DateTimeFormatter format) {
        if (format != null) {
            return LocalDateTime.parse(text, format);
        }
        DateTimeParseException last = null;
        for (DateTimeFormatter candidate : LOCAL_FORMATS) {
            try {
                return LocalDateTime.parse(text, candidate);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        throw last;
    }

    static Instant localToInstant(LocalDateTime local, ZoneId zone) {
        ZoneRules rules = zone.getRules();
        List<ZoneOffset> offsets = rules.getValidOffsets(local);
        if (offsets.size() == 1) {
            return local.toInstant(offsets.get(0));
        }
        ZoneOffsetTransition transition = rules.getTransition(local);
        if (offsets.isEmpty()) {
            return transition.getInstant();
        }
        throw new DateTimeException("Ambiguous local time " + local + " in zone " + zone);
    }
}
