/**
 * Cam Sentinel watcher service: process entry point, process-level
 * configuration and the health endpoint.
 *
 * <p>
 * Device protocol adapters live in
 * {@link com.camsentinel.service.onvif} (event subscription) and
 * {@link com.camsentinel.service.capture} (recorder and snapshots).
 * </p>
 */
package com.camsentinel.service;
