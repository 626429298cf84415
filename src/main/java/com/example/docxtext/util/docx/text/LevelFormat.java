package com.example.docxtext.util.docx.text;

/**
 * 编号某一层的格式与起始值
 */
public final class LevelFormat {

    private final String numFmt;
    private final int start;

    public LevelFormat(String numFmt, int start) {
        this.numFmt = numFmt;
        this.start = start;
    }

    public String getNumFmt() { return numFmt; }

    public int getStart() { return start; }

    LevelFormat withStart(int newStart) {
        return new LevelFormat(numFmt, newStart);
    }

    @Override
    public String toString() {
        return numFmt + "@" + start;
    }
}
