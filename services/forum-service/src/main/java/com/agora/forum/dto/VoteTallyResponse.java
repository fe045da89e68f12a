package com.agora.forum.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * VoteTallyResponse - live up/down counts for one post or comment.
 *
 * <pre>
 * GET /api/posts/5/votes
 * { "upvotes": 3, "downvotes": 1 }
 * </pre>
 *
 * Counts are read from the vote rows on every request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoteTallyResponse {

    private long upvotes;
    private long downvotes;
}
