/**
 * Environment-driven configuration.
 * <ul>
 *   <li>{@link com.treeds.config.TreeConfig} – TREEDS_* variables with defaults</li>
 *   <li>{@link com.treeds.config.TreeBootstrap} – builds a {@link com.treeds.config.TreeContext} (generator, node factory, codec)</li>
 * </ul>
 */
package com.treeds.config;
