/**
 * Engine configuration: the immutable
 * {@link com.realtimeanalytics.core.config.EngineConfig} and its YAML loader
 * {@link com.realtimeanalytics.core.config.EngineConfigLoader}.
 *
 * <p>
 * Invalid values are rejected when the configuration is built, so the
 * engine fails fast at construction rather than at the first write.
 * </p>
 *
 * @since 1.0.0
 */
package com.realtimeanalytics.core.config;
