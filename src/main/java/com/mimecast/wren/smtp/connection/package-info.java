/**
 * Reply side of client connections.
 */
package com.mimecast.wren.smtp.connection;
