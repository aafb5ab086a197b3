package com.jimin.feedreader.service;

import com.jimin.feedreader.dto.ExtractedItem;
import com.jimin.feedreader.dto.RawEntry;
import com.rometools.rome.io.impl.DateParser;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.List;
import java.util.Locale;

/**
 * RawEntry → ExtractedItem 변환
 *
 * 필드마다 후보 key 목록을 우선순위대로 조회하고 처음 찾은 값을 사용함.
 * I/O 없음, 예외 없음 (값이 없으면 기본값 또는 null)
 */
@Component
public class FieldExtractor {

    public static final String UNTITLED = "Untitled";

    private static final List<String> GUID_FIELDS = List.of(RawEntry.ID, RawEntry.LINK);

    // content 목록 다음 순서
    private static final List<String> TEXT_FIELDS = List.of(RawEntry.SUMMARY, RawEntry.DESCRIPTION);

    private static final List<String> PARSED_DATE_FIELDS =
            List.of(RawEntry.PUBLISHED_PARSED, RawEntry.UPDATED_PARSED, RawEntry.CREATED_PARSED);

    private static final List<String> STRING_DATE_FIELDS =
            List.of(RawEntry.PUBLISHED, RawEntry.UPDATED, RawEntry.CREATED);

    private final ZoneId zoneId;

    public FieldExtractor(Clock clock) {
        this.zoneId = clock.getZone();
    }

    public ExtractedItem extract(RawEntry entry) {
        return new ExtractedItem(
                extractGuid(entry),
                extractTitle(entry),
                extractContent(entry),
                extractPublishedAt(entry),
                trimToNull(entry.getString(RawEntry.LINK)),
                trimToNull(entry.getString(RawEntry.AUTHOR))
        );
    }

    /**
     * id → link → null
     */
    String extractGuid(RawEntry entry) {
        for (String field : GUID_FIELDS) {
            String value = trimToNull(entry.getString(field));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    String extractTitle(RawEntry entry) {
        String title = trimToNull(entry.getString(RawEntry.TITLE));
        return title != null ? title : UNTITLED;
    }

    /**
     * content 목록의 첫 값 → summary → description → ""
     */
    String extractContent(RawEntry entry) {
        List<String> contents = entry.getStrings(RawEntry.CONTENT);
        if (!contents.isEmpty()) {
            return contents.get(0);
        }
        for (String field : TEXT_FIELDS) {
            String value = entry.getString(field);
            if (value != null) {
                return value;
            }
        }
        return "";
    }

    /**
     * 파서가 해석한 날짜(published → updated → created) → 원문 문자열 재해석 → null
     */
    LocalDateTime extractPublishedAt(RawEntry entry) {
        for (String field : PARSED_DATE_FIELDS) {
            Date date = entry.getDate(field);
            if (date != null) {
                return toLocalDateTime(date.toInstant());
            }
        }
        for (String field : STRING_DATE_FIELDS) {
            Instant instant = parseDateString(entry.getString(field));
            if (instant != null) {
                return toLocalDateTime(instant);
            }
        }
        return null;
    }

    /**
     * RFC 822 / W3C 날짜 (Rome DateParser) → ISO-8601
     */
    Instant parseDateString(String value) {
        String text = trimToNull(value);
        if (text == null) {
            return null;
        }
        Date date = DateParser.parseDate(text, Locale.US);
        if (date != null) {
            return date.toInstant();
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            return parseLocalDateTime(text);
        }
    }

    // 오프셋 없는 ISO 형식은 시스템 시간대로 해석
    private Instant parseLocalDateTime(String text) {
        try {
            return LocalDateTime.parse(text).atZone(zoneId).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private LocalDateTime toLocalDateTime(Instant instant) {
        return LocalDateTime.ofInstant(instant, zoneId);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
