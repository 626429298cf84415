package com.example.docxtext.util.docx.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 批注：被批注的正文、作者、日期、批注内容
 */
public final class Comment {

    @JsonProperty("reference")
    private final String reference;

    @JsonProperty("author")
    private final String author;

    @JsonProperty("date")
    private final String date;

    @JsonProperty("text")
    private final String text;

    public Comment(String reference, String author, String date, String text) {
        this.reference = reference;
        this.author = author;
        this.date = date;
        this.text = text;
    }

    public String getReference() { return reference; }

    public String getAuthor() { return author; }

    public String getDate() { return date; }

    public String getText() { return text; }

    @Override
    public String toString() {
        return "Comment(" + reference + ", " + author + ", " + date + ", " + text + ")";
    }
}
