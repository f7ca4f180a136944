/**
 * Superstep scheduler and run handle.
 *
 * <p>{@link io.shipgraph.runtime.GraphRuntime} loads a thread's checkpoint, runs each frontier
 * on a bounded worker pool, merges task updates through the channel reducers in task-index
 * order and saves a checkpoint after every committed superstep. Interrupts suspend the
 * superstep with the writes of the tasks that finished; a resumed node restarts from its
 * beginning, so fan-out workers should not interrupt.
 */
package io.shipgraph.runtime;
