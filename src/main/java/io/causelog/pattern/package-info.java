/**
 * Helpers that write events as external triggers or internal reactions.
 */
package io.causelog.pattern;
