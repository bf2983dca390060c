package com.healloop.core.engine;

/**
 * What a tool reported back.
 *
 * @param status "success" or "error"
 * @param result tool output, opaque to the engine
 * @param error  error text when the status is not success
 */
public record ToolOutcome(String status, Object result, String error) {

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    public static ToolOutcome success(Object result) {
        return new ToolOutcome(SUCCESS, result, null);
    }

    public static ToolOutcome error(String error) {
        return new ToolOutcome(ERROR, null, error);
    }

    public boolean isSuccess() {
        return SUCCESS.equalsIgnoreCase(status);
    }
}
