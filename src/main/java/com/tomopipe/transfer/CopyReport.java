package com.tomopipe.transfer;

public record CopyReport(int copied, int skipped, long bytesCopied) {

    public static final CopyReport EMPTY = new CopyReport(0, 0, 0L);

    public CopyReport plus(CopyReport other) {
        return new CopyReport(copied + other.copied, skipped + other.skipped, bytesCopied + other.bytesCopied);
    }

    public boolean nothingCopied() {
        return copied == 0;
    }
}
