package com.mimecast.wren.smtp.session;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * Message body accumulator for the DATA phase.
 *
 * <p>Finds the {@code CRLF "." CRLF} terminator regardless of how the body is split into chunks.
 * <br>The last four bytes seen are held back since they may be the start of a terminator,
 * so only bytes that are definitely body are ever committed.
 * <br>The held suffix starts as the CRLF that ended the DATA command line,
 * hence a body consisting of a single {@code "." CRLF} line is empty.
 *
 * <p>In buffering mode committed bytes are kept and returned by {@link #getBody()}.
 * <br>In streaming mode they are returned from each {@link #feed(byte[])} call for a handler to consume.
 * <p>No dot-unstuffing is done, the body is opaque.
 */
public class BodyAccumulator {

    /**
     * End of body sequence.
     */
    static final byte[] TERMINATOR = {'\r', '\n', '.', '\r', '\n'};

    /**
     * Bytes held back between chunks.
     */
    private static final int HOLD = TERMINATOR.length - 1;

    private static final byte[] EMPTY = new byte[0];

    private final boolean buffering;
    private final long sizeLimit;
    private final ByteArrayOutputStream body = new ByteArrayOutputStream();

    /**
     * Trailing bytes not yet committed.
     */
    private byte[] held = {'\r', '\n'};

    /**
     * Leading held bytes that belong to the DATA line.
     */
    private int seed = 2;

    private long size = 0L;
    private boolean overflow = false;
    private boolean discarded = false;
    private boolean complete = false;

    /**
     * Constructs a new BodyAccumulator instance.
     *
     * @param buffering Keep body bytes, false when a streaming handler consumes them.
     * @param sizeLimit Body size limit in bytes, 0 for unlimited.
     */
    public BodyAccumulator(boolean buffering, long sizeLimit) {
        this.buffering = buffering;
        this.sizeLimit = sizeLimit;
    }

    /**
     * Feeds a chunk.
     *
     * @param chunk Bytes as received.
     * @return Feed instance.
     */
    public Feed feed(byte[] chunk) {
        if (complete) {
            throw new IllegalStateException("Terminator already received");
        }

        byte[] window = concat(held, chunk);
        int index = indexOf(window, TERMINATOR);

        if (index >= 0) {
            complete = true;
            byte[] available = commit(window, Math.min(seed, index), index);

            int consumed = index + TERMINATOR.length - held.length;
            byte[] remainder = Arrays.copyOfRange(chunk, consumed, chunk.length);

            held = EMPTY;
            seed = 0;
            return new Feed(available, true, remainder);
        }

        int end = window.length - Math.min(HOLD, window.length);
        int start = Math.min(seed, end);
        byte[] available = commit(window, start, end);

        seed -= start;
        held = Arrays.copyOfRange(window, end, window.length);
        return new Feed(available, false, EMPTY);
    }

    /**
     * Stops keeping or handing out body bytes until the terminator.
     */
    public void discard() {
        discarded = true;
        body.reset();
    }

    /**
     * Gets buffered body.
     *
     * @return Byte array, empty in streaming mode.
     */
    public byte[] getBody() {
        return body.toByteArray();
    }

    /**
     * Gets number of body bytes committed so far, discarded ones included.
     *
     * @return Size in bytes.
     */
    public long getSize() {
        return size;
    }

    public boolean isBuffering() {
        return buffering;
    }

    public boolean isOverflow() {
        return overflow;
    }

    public boolean isDiscarded() {
        return discarded;
    }

    public boolean isComplete() {
        return complete;
    }

    private byte[] commit(byte[] window, int start, int end) {
        if (end <= start) {
            return EMPTY;
        }

        size += end - start;
        if (sizeLimit > 0 && size > sizeLimit && !overflow) {
            overflow = true;
            body.reset();
        }
        if (overflow || discarded) {
            return EMPTY;
        }

        if (buffering) {
            body.write(window, start, end - start);
            return EMPTY;
        }
        return Arrays.copyOfRange(window, start, end);
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] result = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, result, a.length, b.length);
        return result;
    }

    private static int indexOf(byte[] data, byte[] pattern) {
        outer:
        for (int i = 0; i <= data.length - pattern.length; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (data[i + j] != pattern[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    /**
     * Result of one {@link #feed(byte[])} call.
     */
    public static final class Feed {
        private final byte[] available;
        private final boolean complete;
        private final byte[] remainder;

        Feed(byte[] available, boolean complete, byte[] remainder) {
            this.available = available;
            this.complete = complete;
            this.remainder = remainder;
        }

        /**
         * Gets body bytes ready for a streaming handler.
         *
         * @return Byte array, empty when buffering.
         */
        public byte[] getAvailable() {
            return available;
        }

        /**
         * Is terminator found.
         *
         * @return Boolean.
         */
        public boolean isComplete() {
            return complete;
        }

        /**
         * Gets bytes following the terminator in the chunk.
         *
         * @return Byte array.
         */
        public byte[] getRemainder() {
            return remainder;
        }
    }
}
