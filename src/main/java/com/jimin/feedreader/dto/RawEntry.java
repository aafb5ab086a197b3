package com.jimin.feedreader.dto;

import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RawEntry - 파싱된 피드 항목 1개의 key/value 뷰
 *
 * RSS item, Atom entry 모양이 달라도 같은 key로 조회할 수 있게 평탄화한 형태.
 * FieldExtractor가 정해진 key 순서대로 조회해서 값을 고름 (먼저 찾은 값 사용)
 */
public final class RawEntry {

    public static final String ID = "id";
    public static final String LINK = "link";
    public static final String TITLE = "title";
    public static final String AUTHOR = "author";

    // List<String>
    public static final String CONTENT = "content";
    public static final String SUMMARY = "summary";
    public static final String DESCRIPTION = "description";

    // java.util.Date (파서가 이미 해석한 날짜)
    public static final String PUBLISHED_PARSED = "published_parsed";
    public static final String UPDATED_PARSED = "updated_parsed";
    public static final String CREATED_PARSED = "created_parsed";

    // 원문 날짜 문자열
    public static final String PUBLISHED = "published";
    public static final String UPDATED = "updated";
    public static final String CREATED = "created";

    private final Map<String, Object> fields;

    private RawEntry(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static RawEntry of(Map<String, ?> fields) {
        Map<String, Object> copy = new LinkedHashMap<>();
        fields.forEach((key, value) -> {
            if (value != null) {
                copy.put(key, value);
            }
        });
        return new RawEntry(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean has(String key) {
        return fields.containsKey(key);
    }

    /**
     * 문자열 값 (없거나 문자열이 아니면 null)
     */
    public String getString(String key) {
        Object value = fields.get(key);
        return value instanceof String s ? s : null;
    }

    public Date getDate(String key) {
        Object value = fields.get(key);
        return value instanceof Date d ? d : null;
    }

    /**
     * 문자열 목록 값. 단일 문자열이면 1개짜리 목록으로 취급
     */
    public List<String> getStrings(String key) {
        Object value = fields.get(key);
        if (value instanceof String s) {
            return List.of(s);
        }
        if (value instanceof List<?> list) {
            return list.stream()
                    .filter(String.class::isInstance)
                    .map(String.class::cast)
                    .toList();
        }
        return List.of();
    }

    @Override
    public String toString() {
        return "RawEntry" + fields.keySet();
    }

    public static final class Builder {

        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, Object value) {
            if (value != null) {
                fields.put(key, value);
            }
            return this;
        }

        public RawEntry build() {
            return new RawEntry(new LinkedHashMap<>(fields));
        }
    }
}
