package com.mailbridge.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mailbridge.exception.ErrorKind;
import lombok.Builder;
import lombok.Value;

/**
 * Uniform result of a tool invocation
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolResponse {

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    String status;
    String message;
    Object data;
    ErrorKind errorKind;
    String errorType;
    String requestId;
    String timestamp;

    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }
}
