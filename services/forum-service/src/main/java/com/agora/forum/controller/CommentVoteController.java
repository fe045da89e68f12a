package com.agora.forum.controller;

import com.agora.forum.dto.MessageResponse;
import com.agora.forum.dto.VoteTallyResponse;
import com.agora.forum.entity.VoteDirection;
import com.agora.forum.entity.VoteTarget;
import com.agora.forum.security.UserId;
import com.agora.forum.service.VoteLedger;
import com.agora.forum.service.VoteOutcome;
import com.agora.forum.service.VoteTally;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * Voting on comments. The direction comes from the route, not the body.
 *
 * - POST /api/comments/{id}/upvote    (authenticated)
 * - POST /api/comments/{id}/downvote  (authenticated)
 * - GET  /api/comments/{id}/votes     (public)
 */
@RestController
@RequestMapping("/api/comments")
@RequiredArgsConstructor
public class CommentVoteController {

    private final VoteLedger voteLedger;

    @PostMapping("/{id}/upvote")
    public ResponseEntity<MessageResponse> upvote(@PathVariable("id") long commentId,
                                                  @AuthenticationPrincipal UserId voter) {
        return cast(voter, commentId, VoteDirection.UP);
    }

    @PostMapping("/{id}/downvote")
    public ResponseEntity<MessageResponse> downvote(@PathVariable("id") long commentId,
                                                    @AuthenticationPrincipal UserId voter) {
        return cast(voter, commentId, VoteDirection.DOWN);
    }

    @GetMapping("/{id}/votes")
    public ResponseEntity<VoteTallyResponse> votes(@PathVariable("id") long commentId) {
        VoteTally tally = voteLedger.tally(VoteTarget.comment(commentId));
        return ResponseEntity.ok(new VoteTallyResponse(tally.getUpvotes(), tally.getDownvotes()));
    }

    private ResponseEntity<MessageResponse> cast(UserId voter, long commentId, VoteDirection direction) {
        VoteOutcome outcome = voteLedger.castVote(voter, VoteTarget.comment(commentId), direction);
        return ResponseEntity.ok(new MessageResponse(outcome.getMessage()));
    }
}
