package com.wasteland.api;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Status code and JSON body of a dispatched request.
 */
public record ApiResponse(int status, JsonElement body) {

    public static final int OK = 200;
    public static final int NOT_FOUND = 404;
    public static final int INTERNAL_ERROR = 500;

    public static ApiResponse ok(JsonElement body) {
        return new ApiResponse(OK, body);
    }

    /**
     * An error response with body {@code {"error": message}}; callers may add detail fields.
     */
    public static ApiResponse error(int status, String message) {
        JsonObject body = new JsonObject();
        body.addProperty("error", message);
        return new ApiResponse(status, body);
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
