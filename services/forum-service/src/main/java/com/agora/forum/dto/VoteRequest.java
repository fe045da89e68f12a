package com.agora.forum.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * {@code {"vote_type": 1}} or {@code {"vote_type": -1}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VoteRequest {

    private Integer voteType;
}
