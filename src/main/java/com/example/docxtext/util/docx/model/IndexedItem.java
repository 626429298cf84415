package com.example.docxtext.util.docx.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 嵌套列表中的一项及其下标路径
 */
public final class IndexedItem {

    private final List<Integer> index;
    private final Object value;

    public IndexedItem(List<Integer> index, Object value) {
        this.index = Collections.unmodifiableList(index);
        this.value = value;
    }

    public List<Integer> getIndex() {
        return index;
    }

    @SuppressWarnings("unchecked")
    public <T> T getValue() {
        return (T) value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IndexedItem)) return false;
        IndexedItem that = (IndexedItem) o;
        return index.equals(that.index) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, value);
    }

    @Override
    public String toString() {
        return "IndexedItem(index=" + index + ", value=" + value + ")";
    }
}
