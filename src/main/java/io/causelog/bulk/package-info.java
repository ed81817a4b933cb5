/**
 * JSONL export and import of the event log.
 */
package io.causelog.bulk;
