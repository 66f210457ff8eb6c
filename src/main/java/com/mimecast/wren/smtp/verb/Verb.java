package com.mimecast.wren.smtp.verb;

import java.util.regex.Pattern;

/**
 * SMTP command keywords understood by the session.
 *
 * <p>Each verb carries the keyword as it appears on the wire and a case-insensitive pattern anchored at line start.
 * <p>{@link #UNRECOGNIZED} is the explicit result for lines that match no keyword; it has no pattern.
 *
 * @see VerbRecognizer
 */
public enum Verb {
    EHLO("EHLO", "^EHLO\\s*"),
    HELO("HELO", "^HELO\\s*"),
    QUIT("QUIT", "^QUIT"),
    MAIL_FROM("MAIL FROM:", "^MAIL FROM:\\s*"),
    RCPT_TO("RCPT TO:", "^RCPT TO:\\s*"),
    DATA("DATA", "^DATA"),
    NOOP("NOOP", "^NOOP"),
    RSET("RSET", "^RSET"),
    VRFY("VRFY", "^VRFY\\s+"),
    EXPN("EXPN", "^EXPN\\s+"),
    HELP("HELP", "^HELP"),
    STARTTLS("STARTTLS", "^STARTTLS"),
    AUTH("AUTH", "^AUTH\\s+"),
    UNRECOGNIZED("", null);

    private final String keyword;
    private final Pattern pattern;

    Verb(String keyword, String regex) {
        this.keyword = keyword;
        this.pattern = regex != null ? Pattern.compile(regex, Pattern.CASE_INSENSITIVE) : null;
    }

    /**
     * Gets keyword.
     *
     * @return Keyword string, empty for {@link #UNRECOGNIZED}.
     */
    public String getKeyword() {
        return keyword;
    }

    /**
     * Tests if given line starts with this verb.
     *
     * @param line Raw command line.
     * @return Boolean, always false for {@link #UNRECOGNIZED}.
     */
    public boolean matches(String line) {
        return pattern != null && line != null && pattern.matcher(line).lookingAt();
    }
}
