package com.pageanalyzer.core.payload;

import java.util.Locale;
import java.util.Objects;

/**
 * 페이로드 최상위 모양.
 * containerKey 는 wrapped/paginated(점 경로, 예: "hits.hits") 와 XML(반복 요소 이름) 에서만 의미가 있다.
 */
public record DetectedStructure(Kind kind, String containerKey) {

    public enum Kind {
        ARRAY_OF_OBJECTS,
        WRAPPED_ARRAY,
        PAGINATED_ENVELOPE,
        SINGLE_OBJECT,
        ERROR_ENVELOPE,
        XML_DOCUMENT,
        SCALAR,
        EMPTY
    }

    public DetectedStructure {
        Objects.requireNonNull(kind, "kind");
    }

    public static DetectedStructure of(Kind kind) {
        return new DetectedStructure(kind, null);
    }

    /** "wrapped_array(data)", "array_of_objects" 형태 */
    public String describe() {
        String k = kind.name().toLowerCase(Locale.ROOT);
        return (containerKey == null || containerKey.isEmpty()) ? k : k + "(" + containerKey + ")";
    }

    @Override
    public String toString() {
        return describe();
    }
}
