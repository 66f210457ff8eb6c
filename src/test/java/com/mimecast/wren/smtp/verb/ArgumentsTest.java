package com.mimecast.wren.smtp.verb;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ArgumentsTest {

    @Test
    void extract() {
        assertEquals("client.example", Arguments.extract(Verb.EHLO, "EHLO client.example\r\n"));
        assertEquals("client.example", Arguments.extract(Verb.HELO, "helo   client.example  \r\n"));
        assertEquals("<a@b.co>", Arguments.extract(Verb.MAIL_FROM, "MAIL FROM:<a@b.co>\r\n"));
        assertEquals("<a@b.co>", Arguments.extract(Verb.MAIL_FROM, "mail from: <a@b.co>\r\n"));
        assertEquals("<c@d.co>", Arguments.extract(Verb.RCPT_TO, "RCPT TO:<c@d.co>\n"));
    }

    @Test
    void extractEmpty() {
        assertEquals("", Arguments.extract(Verb.EHLO, "EHLO\r\n"));
        assertEquals("", Arguments.extract(Verb.MAIL_FROM, "MAIL FROM:\r\n"));
        assertEquals("", Arguments.extract(Verb.QUIT, null));
    }

    @Test
    void extractKeepsParameters() {
        assertEquals("<a@b.co> SIZE=1024", Arguments.extract(Verb.MAIL_FROM, "MAIL FROM:<a@b.co> SIZE=1024\r\n"));
    }

    @Test
    void stripBrackets() {
        assertEquals("a@b.co", Arguments.stripBrackets("<a@b.co>"));
        assertEquals("a@b.co", Arguments.stripBrackets("a@b.co"));
        assertEquals("", Arguments.stripBrackets("<>"));
        assertEquals("a@b.co", Arguments.stripBrackets("<<a@b.co>>"));
    }
}
