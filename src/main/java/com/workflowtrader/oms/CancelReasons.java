package com.workflowtrader.oms;

/** Cancellation reasons stored on limit orders canceled by the service or on a user's request. */
public final class CancelReasons {

    public static final String UNFILLED_WITHIN_INTERVAL = "Could not fill within interval";
    public static final String WORKFLOW_INACTIVE = "Workflow inactive";
    public static final String API_KEY_REMOVED = "API key removed";
    public static final String WORKFLOW_STOPPED = "Workflow stopped";
    public static final String CANCELED_BY_USER = "Canceled by user";

    private CancelReasons() {}
}
