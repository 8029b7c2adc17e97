package com.tenantoptions.database.trigger;

/** Live view of the triggers installed in the database. */
public interface TriggerCatalog {

    boolean exists(String triggerName);
}
