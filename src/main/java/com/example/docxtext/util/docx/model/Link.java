package com.example.docxtext.util.docx.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 超链接（地址, 文本）
 */
public final class Link {

    @JsonProperty("href")
    private final String href;

    @JsonProperty("text")
    private final String text;

    public Link(String href, String text) {
        this.href = href;
        this.text = text;
    }

    public String getHref() { return href; }

    public String getText() { return text; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Link)) return false;
        Link link = (Link) o;
        return Objects.equals(href, link.href) && Objects.equals(text, link.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(href, text);
    }

    @Override
    public String toString() {
        return "(" + href + ", " + text + ")";
    }
}
