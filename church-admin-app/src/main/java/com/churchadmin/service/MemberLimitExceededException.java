package com.churchadmin.service;

/**
 * Thrown when an import would take a church past its subscription plan's member limit.
 */
public class MemberLimitExceededException extends RuntimeException {

    public MemberLimitExceededException(String message) {
        super(message);
    }
}
