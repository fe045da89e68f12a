package com.agora.forum.controller;

import com.agora.forum.dto.MessageResponse;
import com.agora.forum.dto.VoteRequest;
import com.agora.forum.dto.VoteTallyResponse;
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
 * Voting on posts.
 *
 * - POST /api/posts/{id}/vote  {"vote_type": 1 | -1}  (authenticated)
 * - GET  /api/posts/{id}/votes                        (public)
 */
@RestController
@RequestMapping("/api/posts")
@RequiredArgsConstructor
public class PostVoteController {

    private final VoteLedger voteLedger;

    @PostMapping("/{id}/vote")
    public ResponseEntity<MessageResponse> vote(@PathVariable("id") long postId,
                                                @RequestBody(required = false) VoteRequest request,
                                                @AuthenticationPrincipal UserId voter) {
        VoteOutcome outcome = voteLedger.castVote(voter, VoteTarget.post(postId), VoteRequests.direction(request));
        return ResponseEntity.ok(new MessageResponse(outcome.getMessage()));
    }

    @GetMapping("/{id}/votes")
    public ResponseEntity<VoteTallyResponse> votes(@PathVariable("id") long postId) {
        VoteTally tally = voteLedger.tally(VoteTarget.post(postId));
        return ResponseEntity.ok(new VoteTallyResponse(tally.getUpvotes(), tally.getDownvotes()));
    }
}
