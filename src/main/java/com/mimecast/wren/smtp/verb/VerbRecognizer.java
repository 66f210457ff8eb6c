package com.mimecast.wren.smtp.verb;

import java.util.List;

/**
 * Command line classifier.
 *
 * <p>Lines are tested against a fixed priority list and the first match wins.
 * <br>A line matching nothing yields {@link Verb#UNRECOGNIZED}, never a previous result.
 */
public final class VerbRecognizer {

    /**
     * Evaluation order.
     */
    private static final List<Verb> PRIORITY = List.of(
            Verb.EHLO,
            Verb.HELO,
            Verb.QUIT,
            Verb.MAIL_FROM,
            Verb.RCPT_TO,
            Verb.DATA,
            Verb.NOOP,
            Verb.RSET,
            Verb.VRFY,
            Verb.EXPN,
            Verb.HELP,
            Verb.STARTTLS,
            Verb.AUTH
    );

    private VerbRecognizer() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Recognizes the verb of given line.
     *
     * @param line Raw command line including any line terminator.
     * @return Verb instance.
     */
    public static Verb recognize(String line) {
        for (Verb verb : PRIORITY) {
            if (verb.matches(line)) {
                return verb;
            }
        }

        return Verb.UNRECOGNIZED;
    }

    /**
     * Gets the evaluation order.
     *
     * @return Unmodifiable list of verbs.
     */
    public static List<Verb> getPriority() {
        return PRIORITY;
    }
}
