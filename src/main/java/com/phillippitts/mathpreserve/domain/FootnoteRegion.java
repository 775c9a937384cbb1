package com.phillippitts.mathpreserve.domain;

/**
 * Half-open source interval {@code [startOffset, endOffset)} covering one footnote body,
 * including its introducing token and closing delimiter.
 */
public record FootnoteRegion(int startOffset, int endOffset) {

    public FootnoteRegion {
        if (startOffset < 0 || endOffset <= startOffset) {
            throw new IllegalArgumentException(
                    "Invalid footnote region [" + startOffset + ", " + endOffset + ")");
        }
    }

    public boolean contains(int offset) {
        return offset >= startOffset && offset < endOffset;
    }
}
