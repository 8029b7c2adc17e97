/**
 * Generation and removal of the triggers rejecting selections whose tenant differs from the
 * selected option's tenant. One {@link com.tenantoptions.database.trigger.TriggerDialect} per
 * supported vendor.
 */
package com.tenantoptions.database.trigger;
