/**
 * Typed identifiers and the boundary parser.
 *
 * <p>Agent, meeting and human references are distinct value types. They are never interchangeable,
 * even when their underlying strings coincide.</p>
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.parley.core.model.AgentId} - autonomous agent</li>
 *   <li>{@link com.ryuqq.parley.core.model.MeetingId} - group conversation</li>
 *   <li>{@link com.ryuqq.parley.core.model.HumanRef} - human participant ({@code human}, {@code human alice})</li>
 * </ul>
 *
 * <h2>Parsing</h2>
 * <p>{@link com.ryuqq.parley.core.model.IdentifierParser} is the only place that turns text into ids.
 * Every id's {@code format()} round-trips through {@code parse()}.
 * {@link com.ryuqq.parley.core.model.RecipientSpec} and {@link com.ryuqq.parley.core.model.SourceSpec}
 * are the parsed forms of routing destinations and wait filters.</p>
 *
 * @since 1.0.0
 * @author Parley Team
 */
package com.ryuqq.parley.core.model;
