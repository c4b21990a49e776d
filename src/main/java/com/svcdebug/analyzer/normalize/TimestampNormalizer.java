package com.svcdebug.analyzer.normalize;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * 把各来源五花八门的时间戳统一成可比较的 LocalDateTime。
 *
 * 尝试顺序：
 * 1. yyyy-MM-dd HH:mm:ss.f（1~6 位小数）
 * 2. HH:mm:ss.f（只有时间，日期补 1900-01-01）
 * 3. yyyy-MM-dd HH:mm:ss
 * 4. HH:mm:ss
 * 5. 整数，按 epoch 微秒解释
 * 都失败就返回 empty，不猜。
 */
@Slf4j
public class TimestampNormalizer {

    /** 只有时间的输入统一挂到这一天上，保证同一批数据之间可比较 */
    public static final LocalDate TIME_ONLY_DATE = LocalDate.of(1900, 1, 1);

    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    private static final DateTimeFormatter ISO_SECONDS_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss");

    private static final DateTimeFormatter ISO_MICROS_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS");

    private static final long MICROS_PER_SECOND = 1_000_000L;

    /** 按优先级排列，true 表示这种格式带日期 */
    private static final List<Layout> LAYOUTS = List.of(
            new Layout(fractional("uuuu-MM-dd HH:mm:ss"), true),
            new Layout(fractional("HH:mm:ss"), false),
            new Layout(strict("uuuu-MM-dd HH:mm:ss"), true),
            new Layout(strict("HH:mm:ss"), false)
    );

    private final ZoneId zone;

    public TimestampNormalizer(ZoneId zone) {
        this.zone = zone;
    }

    public Optional<LocalDateTime> normalize(Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        if (raw instanceof Number number) {
            return Optional.of(fromEpochMicros(number.longValue()));
        }

        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }

        for (Layout layout : LAYOUTS) {
            try {
                if (layout.withDate()) {
                    return Optional.of(LocalDateTime.parse(text, layout.formatter()));
                }
                return Optional.of(LocalTime.parse(text, layout.formatter()).atDate(TIME_ONLY_DATE));
            } catch (DateTimeParseException e) {
                log.trace("Layout miss for '{}': {}", text, e.getMessage());
            }
        }

        try {
            return Optional.of(fromEpochMicros(Long.parseLong(text)));
        } catch (NumberFormatException e) {
            log.debug("Unparsable timestamp: {}", text);
            return Optional.empty();
        }
    }

    /**
     * 固定的展示格式：HH:mm:ss.SSS，与输入格式无关。
     */
    public static String format(LocalDateTime ts) {
        return ts == null ? null : DISPLAY_FORMAT.format(ts);
    }

    /**
     * 时间线用的 ISO 格式：秒一定输出；微秒部分非零时才输出，固定 6 位。
     * 例如 2024-05-01T12:00:00、2024-05-01T12:00:00.250000。
     */
    public static String isoFormat(LocalDateTime ts) {
        if (ts == null) {
            return null;
        }
        LocalDateTime micros = ts.truncatedTo(ChronoUnit.MICROS);
        return micros.getNano() == 0 ? ISO_SECONDS_FORMAT.format(micros) : ISO_MICROS_FORMAT.format(micros);
    }

    public ZoneId getZone() {
        return zone;
    }

    private LocalDateTime fromEpochMicros(long micros) {
        Instant instant = Instant.ofEpochSecond(
                Math.floorDiv(micros, MICROS_PER_SECOND),
                Math.floorMod(micros, MICROS_PER_SECOND) * 1_000L);
        return LocalDateTime.ofInstant(instant, zone);
    }

    private static DateTimeFormatter fractional(String pattern) {
        return new DateTimeFormatterBuilder()
                .appendPattern(pattern)
                .appendFraction(ChronoField.NANO_OF_SECOND, 1, 6, true)
                .toFormatter()
                .withResolverStyle(ResolverStyle.STRICT);
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }

    private record Layout(DateTimeFormatter formatter, boolean withDate) {
    }
}
