package com.eventwatch.core;

/**
 * The handler being observed. Returns the response status code.
 */
@FunctionalInterface
public interface Downstream {

    int proceed() throws Exception;
}
