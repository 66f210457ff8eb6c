/**
 * The heart of Wren, an SMTP submission engine whose every milestone can be vetoed by a handler.
 *
 * <p>Provides the listener, the per connection session and the hook registry.
 * <br>This can be used programmatically to embed a receiving server.
 *
 * <h2>Server example:</h2>
 * <pre>
 *     Foundation.init("cfg/");
 *
 *     SmtpServer server = new SmtpServer(Config.getServer());
 *     server.getHooks()
 *             // Offered the shape checked address, may replace it.
 *             .onRcptTo((address, continuation, session) -&gt; {
 *                 if (directory.exists(address)) {
 *                     continuation.accept();
 *                 } else {
 *                     continuation.reject("no such user", false, 550);
 *                 }
 *             })
 *
 *             // Whole body once the terminator is read.
 *             .onDataEnd((body, continuation, session) -&gt; {
 *                 executor.submit(() -&gt; {
 *                     store(session.getFromAddress(), session.getRecipients(), body);
 *                     continuation.accept(); // Resolving later from another thread is fine.
 *                 });
 *             })
 *
 *             // Once per connection.
 *             .onEnd(session -&gt; log.info("Done with {}", session.getRemoteAddress()));
 *
 *     server.start();
 * </pre>
 *
 * <p>Without a handler for a milestone the built-in behaviour applies and the session answers by itself.
 */
package com.mimecast.wren.smtp;
