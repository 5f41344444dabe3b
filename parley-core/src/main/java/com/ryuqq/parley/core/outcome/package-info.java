/**
 * Tagged results returned by routing, streaming and meeting operations.
 *
 * <h2>Results</h2>
 * <ul>
 *   <li>{@link com.ryuqq.parley.core.outcome.DeliveryReport} - fan-out result with per-recipient failures</li>
 *   <li>{@link com.ryuqq.parley.core.outcome.StreamStartResult} - started or skipped, never an empty return</li>
 *   <li>{@link com.ryuqq.parley.core.outcome.LeaveResult} / {@link com.ryuqq.parley.core.outcome.InviteResult}
 *       - idempotent membership changes</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Parley Team
 */
package com.ryuqq.parley.core.outcome;
