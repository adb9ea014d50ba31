/**
 * Delivery channels.
 *
 * <p>A {@link io.campaign.notify.Notifier} sends one message to one destination. Dispatch
 * looks the notifier up by channel name in a {@link io.campaign.notify.NotifierRegistry},
 * so adding a channel only needs a new implementation registered under its name.
 */
package io.campaign.notify;
