/**
 * Command line recognition and argument parsing.
 */
package com.mimecast.wren.smtp.verb;
