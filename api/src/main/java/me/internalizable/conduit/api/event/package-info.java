/**
 * In-process publish/subscribe API.
 *
 * <ul>
 *   <li>{@link EventBus} - Routes events to handlers</li>
 *   <li>{@link Event} - Immutable record of something that happened</li>
 *   <li>{@link EventHandler} - Reacts to one or more event types</li>
 *   <li>{@link EventMiddleware} - Transforms or cancels events before dispatch</li>
 *   <li>{@link HandlerResult} - Outcome of one handler for a waited publish</li>
 * </ul>
 */
package me.internalizable.conduit.api.event;
