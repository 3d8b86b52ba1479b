package com.chicu.aimodelops.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class CommandResponse {

    private boolean accepted;
    private String message;
    private Object data;

    public static CommandResponse accepted(String message, Object data) {
        return new CommandResponse(true, message, data);
    }

    public static CommandResponse ignored(String message) {
        return new CommandResponse(false, message, null);
    }
}
