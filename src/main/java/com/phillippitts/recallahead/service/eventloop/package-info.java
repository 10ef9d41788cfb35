/**
 * Single-threaded cooperative scheduling for orchestrators.
 *
 * <p>All orchestrators of the application share one loop thread ({@code recall-loop-1}).
 * Work arriving from HTTP threads or from completing network futures is re-dispatched onto the
 * loop, so orchestrator state never needs locks.
 *
 * @since 1.0
 */
package com.phillippitts.recallahead.service.eventloop;
