package com.minimail.protocol;

import io.netty.buffer.ByteBuf;

/**
 * Dot-stuffing for multi-line bodies terminated by a lone "." line
 * (RFC 5321 section 4.5.2, RFC 1939 section 3)
 */
public final class DotStuffing {

    private DotStuffing() {}

    /**
     * True if the raw line (ending included) is the lone terminator
     */
    public static boolean isTerminator(byte[] line) {
        int end = contentLength(line);
        return end == 1 && line[0] == '.';
    }

    /**
     * Undo stuffing on one received line: a leading "." is dropped
     */
    public static byte[] unstuff(byte[] line) {
        if (line.length > 0 && line[0] == '.') {
            byte[] out = new byte[line.length - 1];
            System.arraycopy(line, 1, out, 0, out.length);
            return out;
        }
        return line;
    }

    /**
     * Write a body to a reply buffer: each line starting with "." gets an
     * extra one, every line ends with CRLF, then the terminator line.
     * Lines already ending in CRLF keep their bytes unchanged.
     */
    public static void writeStuffed(byte[] body, int offset, int length, ByteBuf out) {
        int end = offset + length;
        int lineStart = offset;
        while (lineStart < end) {
            int lf = lineStart;
            while (lf < end && body[lf] != '\n') {
                lf++;
            }
            if (body[lineStart] == '.') {
                out.writeByte('.');
            }
            if (lf < end) {
                boolean hasCr = lf > lineStart && body[lf - 1] == '\r';
                out.writeBytes(body, lineStart, (hasCr ? lf - 1 : lf) - lineStart);
                out.writeByte('\r').writeByte('\n');
                lineStart = lf + 1;
            } else {
                out.writeBytes(body, lineStart, end - lineStart);
                out.writeByte('\r').writeByte('\n');
                lineStart = end;
            }
        }
        out.writeByte('.').writeByte('\r').writeByte('\n');
    }

    /**
     * Octets of a body once every line ends with CRLF, stuffing not counted.
     * Matches what {@link #writeStuffed} sends before dot-stuffing.
     */
    public static int canonicalLength(byte[] body) {
        int size = body.length;
        for (int i = 0; i < body.length; i++) {
            if (body[i] == '\n' && (i == 0 || body[i - 1] != '\r')) {
                size++;
            }
        }
        if (body.length > 0 && body[body.length - 1] != '\n') {
            size += 2;
        }
        return size;
    }

    private static int contentLength(byte[] line) {
        int end = line.length;
        if (end > 0 && line[end - 1] == '\n') {
            end--;
            if (end > 0 && line[end - 1] == '\r') {
                end--;
            }
        }
        return end;
    }
}
