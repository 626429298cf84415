package com.example.docxtext.util.docx.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 段落在编号列表中的位置
 *
 * listId 为源文件中的 numId（不透明标识，不保证连续）；
 * path 为第0层到当前层每一层的序号（从0起）。
 *
 * 例如：
 * <pre>
 * 1. item            -> ("2", [0])
 *    a. item         -> ("2", [0, 0])
 *    b. item         -> ("2", [0, 1])  // 本段落
 * </pre>
 * 非编号段落为 {@link #NONE}。
 */
public final class ListPosition {

    public static final ListPosition NONE = new ListPosition(null, Collections.emptyList());

    @JsonProperty("list_id")
    private final String listId;

    @JsonProperty("path")
    private final List<Integer> path;

    public ListPosition(String listId, List<Integer> path) {
        this.listId = listId;
        this.path = Collections.unmodifiableList(new ArrayList<>(path));
    }

    public String getListId() { return listId; }

    public List<Integer> getPath() { return path; }

    public boolean isNumbered() {
        return listId != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ListPosition)) return false;
        ListPosition that = (ListPosition) o;
        return Objects.equals(listId, that.listId) && path.equals(that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(listId, path);
    }

    @Override
    public String toString() {
        return "(" + (listId == null ? "None" : "\"" + listId + "\"") + ", " + path + ")";
    }
}
