package com.mimecast.wren.smtp;

import com.mimecast.wren.config.server.ServerConfig;
import com.mimecast.wren.smtp.connection.ConnectionMock;
import com.mimecast.wren.smtp.hook.HookEvent;
import com.mimecast.wren.smtp.session.Session;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SmtpServerTest {

    private SmtpServer server;

    @BeforeEach
    void setUp() {
        server = new SmtpServer(new ServerConfig(Map.of(
                "hostname", "test.example.com",
                "banner", "Wren Test",
                "bind", "127.0.0.1",
                "smtpPort", 0,
                "smtpConfig", Map.of("minimumPoolSize", 1, "maximumPoolSize", 4, "readBufferSize", 16)
        )));
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private Socket connect() throws InterruptedException, IOException {
        server.start();
        assertTrue(server.getListener().awaitReady(5000));

        Socket socket = new Socket("127.0.0.1", server.getListener().getPort());
        socket.setSoTimeout(5000);
        return socket;
    }

    private static void write(OutputStream outputStream, String text) throws IOException {
        outputStream.write(text.getBytes(StandardCharsets.UTF_8));
        outputStream.flush();
    }

    @Test
    void exchange() throws Exception {
        AtomicReference<byte[]> received = new AtomicReference<>();
        AtomicReference<List<String>> recipients = new AtomicReference<>();
        CountDownLatch ended = new CountDownLatch(1);

        server.getHooks()
                .onDataEnd((body, continuation, session) -> {
                    received.set(body);
                    recipients.set(session.getRecipients());
                    continuation.accept();
                })
                .onEnd(session -> ended.countDown());

        try (Socket socket = connect()) {
            BufferedReader reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            OutputStream outputStream = socket.getOutputStream();

            assertEquals("220 test.example.com ESMTP Wren Test", reader.readLine());

            write(outputStream, "EHLO client.example\r\n");
            assertEquals("250-test.example.com Hello 127.0.0.1", reader.readLine());
            assertEquals("250 8BITMIME", reader.readLine());

            write(outputStream, "MAIL FROM:<a@b.co>\r\nRCPT TO:<c@d.co>\r\nDATA\r\n");
            assertEquals("250 OK", reader.readLine());
            assertEquals("250 OK", reader.readLine());
            assertTrue(reader.readLine().startsWith("354 "));

            // Larger than the read buffer so the body arrives in several chunks.
            write(outputStream, "Subject: hi\r\n\r\nthis body spans more than one read\r\n.\r\n");
            assertEquals("250 OK", reader.readLine());

            write(outputStream, "QUIT\r\n");
            assertEquals("221 test.example.com closing connection", reader.readLine());
            assertNull(reader.readLine());
        }

        assertTrue(ended.await(5, TimeUnit.SECONDS));
        assertEquals("Subject: hi\r\n\r\nthis body spans more than one read",
                new String(received.get(), StandardCharsets.UTF_8));
        assertEquals(List.of("c@d.co"), recipients.get());
    }

    @Test
    void clientDisconnect() throws Exception {
        CountDownLatch ended = new CountDownLatch(1);
        AtomicReference<String> helo = new AtomicReference<>();
        server.getHooks().onEnd(session -> {
            helo.set(session.getHeloHost());
            ended.countDown();
        });

        try (Socket socket = connect()) {
            BufferedReader reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            assertTrue(reader.readLine().startsWith("220 "));

            write(socket.getOutputStream(), "HELO client\r\n");
            assertTrue(reader.readLine().startsWith("250 "));
        }

        assertTrue(ended.await(5, TimeUnit.SECONDS));
        assertEquals("client", helo.get());
    }

    @Test
    void hooksSnapshotPerConnection() {
        server.getHooks().onRcptTo((address, continuation, session) -> continuation.accept());
        Session first = server.onConnection(new ConnectionMock(new StringBuilder()), server.getConfig().getSmtpConfig());

        server.getHooks().onDataEnd((body, continuation, session) -> continuation.accept());

        assertTrue(first.getRegisteredHooks().contains(HookEvent.RCPT_TO));
        assertFalse(first.getRegisteredHooks().contains(HookEvent.DATA_END));
    }
}
