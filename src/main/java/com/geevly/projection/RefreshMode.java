package com.geevly.projection;

public enum RefreshMode {
    /** Refresh on the caller's thread before the command returns. */
    SYNC,
    /** Refresh on the projection executor; readers may briefly see the previous row. */
    ASYNC
}
