package com.tomopipe.denoise;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Image dimensions from the fixed 1024-byte MRC header. Byte order follows the machine stamp at
 * offset 212; files without a recognisable stamp are read as little-endian.
 */
public record MrcHeader(int nx, int ny, int nz) {
    private static final int STAMP_OFFSET = 212;
    private static final int READ_LENGTH = 216;

    public static MrcHeader read(Path path) throws IOException {
        byte[] bytes;
        try (InputStream in = Files.newInputStream(path)) {
            bytes = in.readNBytes(READ_LENGTH);
        }
        if (bytes.length < 12) {
            throw new IOException("Truncated MRC header in " + path);
        }
        ByteOrder order = bytes.length == READ_LENGTH && bytes[STAMP_OFFSET] == 0x11
                ? ByteOrder.BIG_ENDIAN
                : ByteOrder.LITTLE_ENDIAN;
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(order);
        MrcHeader header = new MrcHeader(buffer.getInt(0), buffer.getInt(4), buffer.getInt(8));
        if (header.nx <= 0 || header.ny <= 0 || header.nz <= 0) {
            throw new IOException("Invalid MRC dimensions " + header + " in " + path);
        }
        return header;
    }
}
