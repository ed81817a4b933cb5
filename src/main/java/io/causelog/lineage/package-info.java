/**
 * Lineage queries over the causation tree.
 *
 * <p>{@link io.causelog.lineage.LineageQueryEngine} walks parents and children one
 * lookup at a time and builds {@link io.causelog.lineage.CausalGraph} snapshots of a
 * correlation for analyses that need the whole transaction in memory.
 */
package io.causelog.lineage;
