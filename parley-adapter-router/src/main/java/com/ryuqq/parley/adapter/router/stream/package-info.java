/**
 * Chunked delivery of one logical message to recipients that can display it incrementally.
 *
 * <p>Start, chunk and complete events are published once per streaming recipient; observers filter
 * by viewer through {@link com.ryuqq.parley.adapter.router.stream.StreamCoordinator#observe}.</p>
 *
 * @since 1.0.0
 * @author Parley Team
 */
package com.ryuqq.parley.adapter.router.stream;
