package com.example.docxtext.util.docx.pkg;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 部件关系表：r:id -> target
 *
 * 超链接、图片都通过 r:id 引用目标；找不到时调用方省略链接或图片占位，不报错。
 */
public interface RelationshipLookup {

    RelationshipLookup EMPTY = id -> Optional.empty();

    Optional<String> resolve(String relationshipId);

    static RelationshipLookup of(Map<String, String> targets) {
        Map<String, String> copy = Collections.unmodifiableMap(new HashMap<>(targets));
        return id -> id == null ? Optional.empty() : Optional.ofNullable(copy.get(id));
    }
}
