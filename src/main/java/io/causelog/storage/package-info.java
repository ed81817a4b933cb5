/**
 * SQLite persistence package.
 *
 * <p>{@link io.causelog.storage.EventStore} owns the write path: validation, parent
 * resolution, insert and projection dispatch inside one transaction. Reads are served
 * per operation from fresh connections opened by {@link io.causelog.storage.Database}.
 */
package io.causelog.storage;
