/**
 * Metric registry holder shared by the SMTP components.
 */
package com.mimecast.wren.metrics;
