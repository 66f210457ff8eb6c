package com.mimecast.wren.smtp.session;

import com.mimecast.wren.main.Config;
import com.mimecast.wren.main.Foundation;
import com.mimecast.wren.smtp.SmtpResponses;
import com.mimecast.wren.smtp.connection.ConnectionMock;
import com.mimecast.wren.smtp.hook.HookRegistry;
import com.mimecast.wren.smtp.hook.Hooks;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.naming.ConfigurationException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SessionTest {

    private static final String HELLO = "250-test.example.com Hello 127.0.0.1\r\n";
    private static final String EIGHTBITMIME = "250 8BITMIME\r\n";
    private static final String OK = SmtpResponses.OK_250 + "\r\n";
    private static final String CLOSING = "221 test.example.com closing connection\r\n";

    private StringBuilder stringBuilder;
    private ConnectionMock connection;

    @BeforeAll
    static void before() throws ConfigurationException {
        Foundation.init("src/test/resources/cfg/");
    }

    @BeforeEach
    void setUp() {
        stringBuilder = new StringBuilder();
        connection = new ConnectionMock(stringBuilder);
    }

    private SessionSettings settings() {
        return SessionSettings.from(Config.getServer(), Config.getServer().getSmtpConfig());
    }

    private Session start(Hooks hooks, SessionSettings settings) {
        Session session = new Session(connection, hooks, settings);
        session.start();
        return session;
    }

    private Session start() {
        return start(Hooks.none(), settings());
    }

    private void send(Session session, String text) {
        session.receive(text.getBytes(StandardCharsets.UTF_8));
    }

    private List<String> lines() {
        connection.parseLines();
        return connection.getLines();
    }

    @Test
    void greeting() {
        Session session = start();

        connection.parseLines();
        assertEquals("220 test.example.com ESMTP Wren Test\r\n", connection.getLine(1));
        assertEquals(SessionState.AWAIT_COMMAND, session.getState());
        assertEquals(GreetingKind.NONE, session.getGreetingKind());
    }

    @Test
    void fullTransaction() {
        Session session = start();

        send(session, "EHLO client.example\r\n");
        send(session, "MAIL FROM:<a@b.co>\r\n");
        send(session, "RCPT TO:<c@d.co>\r\n");
        assertEquals("a@b.co", session.getFromAddress());
        assertEquals(List.of("c@d.co"), session.getRecipients());

        send(session, "DATA\r\n");
        assertTrue(session.isInData());

        send(session, "Subject: hi\r\n\r\nbody\r\n.\r\n");
        assertFalse(session.isInData());
        assertArrayEquals("Subject: hi\r\n\r\nbody".getBytes(StandardCharsets.UTF_8), session.getBody());

        send(session, "QUIT\r\n");

        assertEquals(List.of(
                "220 test.example.com ESMTP Wren Test\r\n",
                HELLO,
                EIGHTBITMIME,
                OK,
                OK,
                SmtpResponses.START_INPUT_354 + "\r\n",
                OK,
                CLOSING
        ), lines());
        assertEquals(SessionState.CLOSED, session.getState());
        assertFalse(connection.isOpen());
        assertEquals(1, connection.getCloseCount());
    }

    @Test
    void pipelinedInSingleChunk() {
        Session session = start();

        send(session, "HELO client\r\nMAIL FROM:<a@b.co>\r\nRCPT TO:<c@d.co>\r\nDATA\r\nbody\r\n.\r\nQUIT\r\n");

        List<String> lines = lines();
        assertEquals(7, lines.size());
        assertEquals("250 test.example.com Hello 127.0.0.1\r\n", lines.get(1));
        assertEquals(OK, lines.get(5));
        assertEquals(CLOSING, lines.get(6));
        assertArrayEquals("body".getBytes(StandardCharsets.UTF_8), session.getBody());
        assertEquals(GreetingKind.HELO, session.getGreetingKind());
        assertFalse(session.isEsmtp());
    }

    @Test
    void commandSplitAcrossChunks() {
        Session session = start();

        send(session, "EH");
        send(session, "LO client.exa");
        assertEquals(1, lines().size());

        send(session, "mple\r\n");
        assertEquals("client.example", session.getHeloHost());
        assertTrue(session.isEsmtp());
    }

    @Test
    void bareLineFeed() {
        Session session = start();

        send(session, "HELO client\n");

        assertEquals("client", session.getHeloHost());
    }

    @Test
    void lineLengthExcludesTerminator() {
        Session session = start(Hooks.none(), settings().setMaxLineLength(10));

        send(session, "NOOP567890\r\n");
        send(session, "NOOP5678901\r\n");
        send(session, "NOOP567890\n");

        List<String> lines = lines();
        assertEquals(OK, lines.get(1));
        assertEquals(SmtpResponses.LINE_TOO_LONG_500 + "\r\n", lines.get(2));
        assertEquals(OK, lines.get(3));
    }

    @Test
    void recipientBeforeSender() {
        Session session = start();

        send(session, "RCPT TO:<x@y.co>\r\n");

        connection.parseLines();
        assertEquals(SmtpResponses.NEED_SENDER_503 + "\r\n", connection.getLine(2));
        assertTrue(connection.isOpen());
        assertTrue(session.getRecipients().isEmpty());
    }

    @Test
    void senderBeforeGreeting() {
        Session session = start();

        send(session, "MAIL FROM:<a@b.co>\r\n");

        connection.parseLines();
        assertEquals(SmtpResponses.NEED_GREETING_503 + "\r\n", connection.getLine(2));
        assertNull(session.getFromAddress());
    }

    @Test
    void invalidSender() {
        Session session = start();

        send(session, "EHLO client.example\r\nMAIL FROM:<bogus>\r\n");

        connection.parseLines();
        assertEquals(SmtpResponses.INVALID_ADDRESS_501 + "\r\n", connection.getLine(4));
        assertNull(session.getFromAddress());
    }

    @Test
    void invalidRecipient() {
        Session session = start();

        send(session, "EHLO client.example\r\nMAIL FROM:<a@b.co>\r\nRCPT TO:<c@d>\r\n");

        connection.parseLines();
        assertEquals(SmtpResponses.INVALID_ADDRESS_501 + "\r\n", connection.getLine(5));
        assertTrue(session.getRecipients().isEmpty());
    }

    @Test
    void dataWithoutRecipient() {
        Session session = start();

        send(session, "EHLO client.example\r\nMAIL FROM:<a@b.co>\r\nDATA\r\n");

        connection.parseLines();
        assertEquals(SmtpResponses.NEED_RECIPIENT_503 + "\r\n", connection.getLine(5));
        assertFalse(session.isInData());
    }

    @Test
    void unsupported() {
        Session session = start();
        send(session, "HELO client\r\n");

        send(session, "FOO\r\n");
        send(session, "VRFY user\r\n");
        send(session, "STARTTLS\r\n");

        List<String> lines = lines();
        assertEquals(SmtpResponses.NOT_SUPPORTED_500 + "\r\n", lines.get(2));
        assertEquals(SmtpResponses.NOT_SUPPORTED_500 + "\r\n", lines.get(3));
        assertEquals(SmtpResponses.NOT_SUPPORTED_500 + "\r\n", lines.get(4));
        assertTrue(connection.isOpen());
        assertEquals("client", session.getHeloHost());
        assertEquals(SessionState.AWAIT_COMMAND, session.getState());
    }

    @Test
    void noop() {
        Session session = start();

        send(session, "NOOP\r\n");

        connection.parseLines();
        assertEquals(OK, connection.getLine(2));
    }

    @Test
    void rset() {
        Session session = start();

        send(session, "EHLO client.example\r\nMAIL FROM:<a@b.co>\r\nRCPT TO:<c@d.co>\r\nRSET\r\n");

        assertNull(session.getFromAddress());
        assertNull(session.getRawMailFrom());
        assertTrue(session.getRecipients().isEmpty());
        assertEquals("client.example", session.getHeloHost());

        send(session, "RCPT TO:<c@d.co>\r\n");

        List<String> lines = lines();
        assertEquals(OK, lines.get(5));
        assertEquals(SmtpResponses.NEED_SENDER_503 + "\r\n", lines.get(6));
    }

    @Test
    void secondGreetingResetsTransaction() {
        Session session = start();

        send(session, "EHLO client.example\r\nMAIL FROM:<a@b.co>\r\nHELO other\r\n");

        assertNull(session.getFromAddress());
        assertEquals("other", session.getHeloHost());
        assertEquals(GreetingKind.EHLO, session.getGreetingKind());
    }

    @Test
    void greetingKindSetByFirstGreeting() {
        Session session = start();

        send(session, "EHLO client.example\r\nHELO other\r\n");
        assertEquals(GreetingKind.EHLO, session.getGreetingKind());
        assertTrue(session.isEsmtp());

        Session helo = start();
        send(helo, "HELO client.example\r\nEHLO other\r\n");
        assertEquals(GreetingKind.HELO, helo.getGreetingKind());
        assertFalse(helo.isEsmtp());
        assertEquals("other", helo.getHeloHost());
    }

    @Test
    void transactionResetAfterMessage() {
        Session session = start();

        send(session, "EHLO client.example\r\nMAIL FROM:<a@b.co>\r\nRCPT TO:<c@d.co>\r\nRCPT TO:<e@f.co>\r\nDATA\r\n");
        assertEquals(List.of("c@d.co", "e@f.co"), session.getRecipients());

        send(session, "hello\r\n.\r\n");

        assertNull(session.getFromAddress());
        assertTrue(session.getRecipients().isEmpty());
        assertEquals("client.example", session.getHeloHost());

        send(session, "MAIL FROM:<g@h.co>\r\n");
        assertEquals("g@h.co", session.getFromAddress());
    }

    @Test
    void emptyBody() {
        Session session = start();

        send(session, "EHLO client.example\r\nMAIL FROM:<a@b.co>\r\nRCPT TO:<c@d.co>\r\nDATA\r\n.\r\n");

        assertNotNull(session.getBody());
        assertEquals(0, session.getBody().length);
        assertFalse(session.isInData());
    }

    @Test
    void bodyNotInterpreted() {
        Session session = start();

        send(session, "EHLO client.example\r\nMAIL FROM:<a@b.co>\r\nRCPT TO:<c@d.co>\r\nDATA\r\n");
        send(session, "QUIT\r\nRSET\r\n");

        assertTrue(session.isInData());
        assertTrue(connection.isOpen());

        send(session, ".\r\n");
        assertArrayEquals("QUIT\r\nRSET".getBytes(StandardCharsets.UTF_8), session.getBody());
    }

    @Test
    void lineTooLong() {
        Session session = start();

        send(session, "EHLO " + "a".repeat(1200) + "\r\n");
        send(session, "HELO client\r\n");

        List<String> lines = lines();
        assertEquals(SmtpResponses.LINE_TOO_LONG_500 + "\r\n", lines.get(1));
        assertEquals("250 test.example.com Hello 127.0.0.1\r\n", lines.get(2));
        assertEquals("client", session.getHeloHost());
    }

    @Test
    void sizeExceeded() {
        Session session = start(Hooks.none(), settings().setEmailSizeLimit(10));

        send(session, "EHLO client.example\r\nMAIL FROM:<a@b.co>\r\nRCPT TO:<c@d.co>\r\nDATA\r\n");
        send(session, "0123456789abcdef\r\n.\r\n");

        List<String> lines = lines();
        assertEquals(SmtpResponses.SIZE_EXCEEDED_552 + "\r\n", lines.get(lines.size() - 1));
        assertNull(session.getBody());
        assertTrue(session.getRecipients().isEmpty());
        assertFalse(session.isInData());
        assertTrue(connection.isOpen());
    }

    @Test
    void endOfStream() {
        AtomicInteger ended = new AtomicInteger();
        Session session = start(new HookRegistry().onEnd(s -> ended.incrementAndGet()).snapshot(), settings());

        session.end();
        session.end();
        session.error(new RuntimeException("late"));

        assertEquals(SessionState.CLOSED, session.getState());
        assertEquals(1, ended.get());
        assertEquals(1, connection.getCloseCount());
    }

    @Test
    void endObserverOnQuit() {
        AtomicInteger ended = new AtomicInteger();
        Session session = start(new HookRegistry()
                .onEnd(s -> ended.incrementAndGet())
                .onEnd(s -> {
                    throw new IllegalStateException("observer failure");
                })
                .onEnd(s -> ended.incrementAndGet())
                .snapshot(), settings());

        send(session, "QUIT\r\n");

        assertEquals(2, ended.get());
        assertNotNull(session.getUID());
        assertEquals(CLOSING, lines().get(1));
    }

    @Test
    void inputAfterClose() {
        Session session = start();

        send(session, "QUIT\r\nNOOP\r\n");
        send(session, "NOOP\r\n");

        assertEquals(2, lines().size());
    }

    @Test
    void writeFailure() {
        AtomicInteger ended = new AtomicInteger();
        Session session = start(new HookRegistry().onEnd(s -> ended.incrementAndGet()).snapshot(), settings());

        connection.failWrites();
        send(session, "NOOP\r\n");

        assertEquals(SessionState.CLOSED, session.getState());
        assertEquals(1, ended.get());
    }
}
