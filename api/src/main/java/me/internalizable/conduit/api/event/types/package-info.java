/**
 * Concrete events published by the host.
 *
 * <p>Each event has a fixed {@code TYPE} constant used for routing, a fixed
 * priority, and typed accessors over its payload.</p>
 *
 * <h2>Messenger Events</h2>
 * <ul>
 *   <li>{@link MessageReceivedEvent} - {@code message.received}</li>
 *   <li>{@link CallbackQueryEvent} - {@code callback.query}</li>
 *   <li>{@link ChatMemberEvent} - {@code chat.member.updated}</li>
 * </ul>
 *
 * <h2>Business Events</h2>
 * <ul>
 *   <li>{@link TaskCreatedEvent} - {@code task.created}</li>
 *   <li>{@link WorkJournalEntryEvent} - {@code work_journal.entry.created}</li>
 * </ul>
 *
 * <h2>AI Events</h2>
 * <ul>
 *   <li>{@link AIRequestEvent} - {@code ai.request}</li>
 *   <li>{@link AIResponseEvent} - {@code ai.response}</li>
 *   <li>{@link ChatSummaryRequestEvent} - {@code chat.summary.request}</li>
 *   <li>{@link AutoTaskDetectedEvent} - {@code ai.auto_task.detected}</li>
 * </ul>
 *
 * <h2>System Events</h2>
 * <ul>
 *   <li>{@link UserAuthenticatedEvent} - {@code user.authenticated}</li>
 *   <li>{@link ErrorEvent} - {@code system.error}</li>
 * </ul>
 */
package me.internalizable.conduit.api.event.types;
