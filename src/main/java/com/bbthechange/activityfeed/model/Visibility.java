package com.bbthechange.activityfeed.model;

/**
 * Visibility of a principal, evaluated at delivery time.
 * PUBLIC principals are visible across federated tenants, LOGGEDIN only within their own tenant,
 * PRIVATE only to their members.
 */
public enum Visibility {
    PUBLIC,
    LOGGEDIN,
    PRIVATE
}
