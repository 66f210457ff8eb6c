package com.mimecast.wren.smtp;

/**
 * SMTP response constants.
 *
 * <p>Responses are organized by category: success codes (2xx), intermediate codes (3xx),
 * temporary failure codes (4xx), and permanent failure codes (5xx).
 * <br>Format placeholders are documented per constant.
 */
public final class SmtpResponses {

    private SmtpResponses() {
        // Utility class.
    }

    // ========== 2xx Success Codes ==========

    /**
     * 220 Service ready - initial greeting.
     * <p>Hostname, banner.
     */
    public static final String GREETING_220 = "220 %s ESMTP %s";

    /**
     * 221 Closing connection.
     * <p>Hostname.
     */
    public static final String CLOSING_221 = "221 %s closing connection";

    /**
     * 250 HELO response.
     * <p>Hostname, peer address.
     */
    public static final String HELLO_250 = "250 %s Hello %s";

    /**
     * 250 EHLO response first line.
     * <p>Hostname, peer address.
     */
    public static final String HELLO_250_MULTILINE = "250-%s Hello %s";

    /**
     * 250 Extension advertisement separator (multi-line).
     */
    public static final String ADVERT_250_MULTILINE = "250-";

    /**
     * 250 Extension advertisement separator (last line).
     */
    public static final String ADVERT_250_LAST = "250 ";

    /**
     * Capability always advertised last.
     */
    public static final String EIGHTBITMIME = "8BITMIME";

    /**
     * 250 OK.
     */
    public static final String OK_250 = "250 OK";

    // ========== 3xx Intermediate Codes ==========

    /**
     * 354 Start mail input.
     */
    public static final String START_INPUT_354 = "354 Terminate with line containing only '.'";

    // ========== 4xx Temporary Failure Codes ==========

    /**
     * 451 status for handler failures and hook timeouts.
     */
    public static final int INTERNAL_ERROR_451 = 451;

    /**
     * Handler failure message.
     */
    public static final String INTERNAL_ERROR_MESSAGE = "Internal server error";

    /**
     * Hook timeout message.
     */
    public static final String HOOK_TIMEOUT_MESSAGE = "Hook timed out";

    // ========== 5xx Permanent Failure Codes ==========

    /**
     * 500 Unrecognized or unsupported command.
     */
    public static final String NOT_SUPPORTED_500 = "500 not supported";

    /**
     * 500 Command line over the configured length.
     */
    public static final String LINE_TOO_LONG_500 = "500 Line too long";

    /**
     * 501 Address shape rejected.
     */
    public static final String INVALID_ADDRESS_501 = "501 keep address simpler. Please. We only support user@host.domain";

    /**
     * 503 MAIL before greeting.
     */
    public static final String NEED_GREETING_503 = "503 we require greeting";

    /**
     * 503 RCPT before MAIL.
     */
    public static final String NEED_SENDER_503 = "503 provide sender first";

    /**
     * 503 DATA before RCPT.
     */
    public static final String NEED_RECIPIENT_503 = "503 need recipient";

    /**
     * 552 Body over the configured size.
     */
    public static final String SIZE_EXCEEDED_552 = "552 Message size exceeds limit";
}
