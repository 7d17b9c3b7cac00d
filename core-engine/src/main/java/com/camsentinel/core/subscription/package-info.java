/**
 * Event subscription layer.
 *
 * <p>
 * {@link com.camsentinel.core.subscription.SubscriptionClient} keeps one
 * device's subscription alive on top of an
 * {@link com.camsentinel.core.subscription.EventSubscriptionTransport} and
 * filters its notifications through
 * {@link com.camsentinel.core.subscription.NotificationParser}. Connection
 * failures surface as
 * {@link com.camsentinel.core.subscription.DeviceConnectException}; the
 * caller paces retries with
 * {@link com.camsentinel.core.subscription.ExponentialBackoff}.
 * </p>
 *
 * @since 1.0.0
 */
package com.camsentinel.core.subscription;
