/**
 * Wren, an embeddable SMTP submission engine.
 *
 * <p>Run standalone with {@code java -jar wren.jar --conf cfg/} or embed {@link com.mimecast.wren.smtp.SmtpServer}.
 */
package com.mimecast.wren;
