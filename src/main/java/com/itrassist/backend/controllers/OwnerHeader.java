package com.itrassist.backend.controllers;

/**
 * Request header that scopes every call to one filer.
 */
public final class OwnerHeader {

    public static final String NAME = "X-Owner-Id";
    public static final String DEFAULT_OWNER = "dev-user";

    private OwnerHeader() {}
}
