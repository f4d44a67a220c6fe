/**
 * Alert persistence and the lifecycle manager that owns deduplication,
 * status transitions and the notified flag.
 */
package com.outbreaksentinel.core.alert;
