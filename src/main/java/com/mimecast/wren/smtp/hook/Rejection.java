package com.mimecast.wren.smtp.hook;

/**
 * Reject outcome of a continuation.
 *
 * @param message    Reply text sent after the status code.
 * @param statusCode SMTP status code.
 * @param close      Close the connection after replying.
 */
public record Rejection(String message, int statusCode, boolean close) {

    /**
     * Status code used when the handler supplies none.
     */
    public static final int DEFAULT_STATUS = 500;

    /**
     * Gets the reply line.
     *
     * @return Reply string.
     */
    public String toReply() {
        return statusCode + " " + message;
    }
}
