package com.gpappid.harvester.harvest.util;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.zip.GZIPInputStream;

public final class GzipPayloads {

    private GzipPayloads() {
    }

    /**
     * Inflates {@code compressed}, reading at most {@code maxBytes} plus one byte so an oversized
     * payload is rejected without inflating it completely.
     */
    public static byte[] gunzip(byte[] compressed, long maxBytes) throws IOException {
        int cap = (int) Math.min(Integer.MAX_VALUE - 1L, Math.max(0L, maxBytes));
        try (GZIPInputStream gzipInputStream = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            byte[] inflated = gzipInputStream.readNBytes(cap + 1);
            if (inflated.length > cap) {
                throw new IOException("decompressed payload exceeds " + cap + " bytes");
            }
            return inflated;
        }
    }
}
