/**
 * Domain model classes for Cam Sentinel.
 *
 * <p>
 * Value objects passed between the subscription, detection and recording
 * layers:
 * </p>
 * <ul>
 * <li>{@link com.camsentinel.core.model.DeviceConfig}: one configured
 * camera</li>
 * <li>{@link com.camsentinel.core.model.RawNotification}: a notification as
 * received from the device</li>
 * <li>{@link com.camsentinel.core.model.DetectionEvent}: a normalized presence
 * notification</li>
 * <li>{@link com.camsentinel.core.model.Subscription}: a live event
 * subscription</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.camsentinel.core.model;
