package com.mimecast.wren.smtp.verb;

import org.apache.commons.lang3.StringUtils;

/**
 * Command argument extraction.
 */
public final class Arguments {

    private Arguments() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Extracts the argument text of a command line.
     * <p>The keyword prefix is removed case-insensitively and surrounding whitespace, line terminator included, is trimmed.
     *
     * @param verb Verb the line was recognized as.
     * @param line Raw command line.
     * @return Argument string, never null.
     */
    public static String extract(Verb verb, String line) {
        return StringUtils.strip(StringUtils.removeStartIgnoreCase(StringUtils.defaultString(line), verb.getKeyword()));
    }

    /**
     * Removes every angle bracket from an address argument.
     *
     * @param argument Argument string.
     * @return Address string.
     */
    public static String stripBrackets(String argument) {
        return StringUtils.replaceChars(argument, "<>", "");
    }
}
