package com.quill.api;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DeleteTableResponse {
    private boolean success;
    private String message;
}
