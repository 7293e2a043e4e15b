package com.quick.bluff.bluff;

import lombok.Data;

@Data
public class ErrorPayload {
    private String action;
    private RejectReason reason;
    private String message;
}
