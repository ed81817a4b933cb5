/**
 * Command handlers, payload migrations and the hooks that observe their outcome.
 */
package io.causelog.projection;
