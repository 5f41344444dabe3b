/**
 * Typed error taxonomy of the Parley core.
 *
 * <p>Every error extends {@link com.ryuqq.parley.core.exception.ParleyException} and carries a stable
 * error code. Surfaced errors (unknown recipient, meeting timeout, malformed identifier, meeting ended)
 * are never downgraded to empty results and never retried inside the core.</p>
 *
 * @since 1.0.0
 * @author Parley Team
 */
package com.ryuqq.parley.core.exception;
