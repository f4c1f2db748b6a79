package com.regencredit.api;

/**
 * Request headers shared by the controllers.
 */
public final class ApiHeaders {

    /** Address of the account issuing the call. */
    public static final String ACCOUNT = "X-Account-Address";

    private ApiHeaders() {
    }
}
