package org.javai.httperror;

import java.nio.charset.Charset;
import java.util.Arrays;
import java.util.Objects;

/**
 * An immutable sequence of raw response body bytes.
 */
public final class ResponseBody {

    private static final ResponseBody EMPTY = new ResponseBody(new byte[0]);

    private final byte[] bytes;

    private ResponseBody(byte[] bytes) {
        this.bytes = bytes;
    }

    public static ResponseBody of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        return bytes.length == 0 ? EMPTY : new ResponseBody(bytes.clone());
    }

    public static ResponseBody empty() {
        return EMPTY;
    }

    /**
     * Returns a copy of the body bytes.
     */
    public byte[] bytes() {
        return bytes.clone();
    }

    public int size() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    public String asString(Charset charset) {
        Objects.requireNonNull(charset, "charset must not be null");
        return new String(bytes, charset);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ResponseBody other && Arrays.equals(bytes, other.bytes));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "ResponseBody[" + bytes.length + " bytes]";
    }
}
