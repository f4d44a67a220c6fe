/**
 * Notification dispatch: recipient resolution, message formatting and the
 * delivery channels.
 */
package com.outbreaksentinel.core.notify;
