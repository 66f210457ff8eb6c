/**
 * Per connection protocol state machine and body accumulation.
 */
package com.mimecast.wren.smtp.session;
