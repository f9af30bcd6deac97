/**
 * Plugin API.
 *
 * <h2>Core Types</h2>
 * <ul>
 *   <li>{@link Plugin} - Base class of every feature module</li>
 *   <li>{@link PluginMetadata} - Name, version and dependencies of a plugin</li>
 *   <li>{@link PluginManager} - Dependency-gated load, unload and reload</li>
 *   <li>{@link PluginContext} - Services bound to a loaded plugin</li>
 * </ul>
 *
 * <h2>Bootstrap</h2>
 * <ul>
 *   <li>{@link PluginCatalog} - Explicit registry of plugin factories</li>
 *   <li>{@link PluginProvider} - Entry point of a plugin jar</li>
 * </ul>
 *
 * <p>Typed plugin bases that react to one class of events live in
 * {@link me.internalizable.conduit.api.plugin.capability}.</p>
 */
package me.internalizable.conduit.api.plugin;
