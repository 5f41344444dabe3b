/**
 * Top-level routing port.
 *
 * <p>{@link com.ryuqq.parley.application.router.MessageRouter} is the inbound entry point for the
 * interpreter layer: route a message, wait for a batch, run a stream.</p>
 *
 * @since 1.0.0
 * @author Parley Team
 */
package com.ryuqq.parley.application.router;
