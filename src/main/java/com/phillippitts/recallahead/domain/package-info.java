/**
 * Domain model shared by the recall client, the orchestrators and the REST layer.
 *
 * @since 1.0
 */
package com.phillippitts.recallahead.domain;
