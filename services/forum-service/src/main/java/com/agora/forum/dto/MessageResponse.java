package com.agora.forum.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * MessageResponse - a one-line outcome, used by the vote endpoints.
 *
 * <pre>
 * { "message": "Vote recorded" }
 * </pre>
 *
 * Possible messages: "Vote recorded", "Vote updated", "Vote removed".
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MessageResponse {

    private String message;
}
