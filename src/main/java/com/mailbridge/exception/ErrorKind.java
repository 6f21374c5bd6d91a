package com.mailbridge.exception;

/**
 * Failure taxonomy reported across the tool boundary
 */
public enum ErrorKind {
    /** Authentication or network failure at store or send time */
    CONNECTION_FAILURE,
    /** Bad request parameters or missing/disabled account, rejected before any I/O */
    VALIDATION_FAILURE,
    /** One message could not be parsed */
    DECODE_FAILURE,
    /** One attachment could not be read or written */
    ATTACHMENT_FAILURE,
    /** One archive is corrupt or unsupported */
    ARCHIVE_FAILURE
}
