/**
 * Accept/reject hooks.
 *
 * <p>A {@link com.mimecast.wren.smtp.hook.HookHandler} is offered a milestone value together with a single-use
 * {@link com.mimecast.wren.smtp.hook.Continuation}.
 * <br>The session does not interpret any further input until the continuation is resolved,
 * synchronously inside the handler or later from any thread.
 *
 * <p>Events and what accepting does:
 * <ul>
 *     <li>connect: sends the greeting.</li>
 *     <li>ehlo: sends the capability reply, optionally with extra capability lines.</li>
 *     <li>helo: sends the hello reply.</li>
 *     <li>mail_from: records the sender, optionally replaced.</li>
 *     <li>rcpt_to: appends the recipient, optionally replaced.</li>
 *     <li>data: sends the 354 reply.</li>
 *     <li>data_available: takes the next body bytes, registering it turns off body buffering.</li>
 *     <li>data_end: accepts the message.</li>
 * </ul>
 * <p>Rejecting replies with the given status and message, then closes the connection if requested.
 */
package com.mimecast.wren.smtp.hook;
