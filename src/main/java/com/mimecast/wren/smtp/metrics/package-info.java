/**
 * SMTP counters.
 */
package com.mimecast.wren.smtp.metrics;
