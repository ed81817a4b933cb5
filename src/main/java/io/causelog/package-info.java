/**
 * CauseLog source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.causelog.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.causelog.cli.CauseLogCommand} maps commands to store and lineage APIs.</li>
 *   <li>{@code io.causelog.storage.EventStore} is the authoritative append-only log.</li>
 *   <li>{@code io.causelog.lineage.LineageQueryEngine} answers causal questions over stored events.</li>
 * </ul>
 */
package io.causelog;
