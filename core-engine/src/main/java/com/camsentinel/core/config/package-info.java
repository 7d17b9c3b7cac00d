/**
 * Configuration loading and validation for Cam Sentinel.
 *
 * <p>
 * The camera list and global settings are defined in YAML (or, for a single
 * camera, in environment variables) and loaded by
 * {@link com.camsentinel.core.config.ConfigLoader} into a
 * {@link com.camsentinel.core.config.WatcherConfig}. Validation runs
 * automatically after parsing; an invalid configuration raises
 * {@link com.camsentinel.core.config.ConfigException}.
 * </p>
 *
 * @since 1.0.0
 */
package com.camsentinel.core.config;
