package com.agora.forum.service;

import com.agora.forum.config.RetryProperties;
import com.agora.forum.entity.Vote;
import com.agora.forum.entity.VoteDirection;
import com.agora.forum.entity.VoteTarget;
import com.agora.forum.exception.NotFoundException;
import com.agora.forum.exception.TransientConflictException;
import com.agora.forum.repository.CommentRepository;
import com.agora.forum.repository.PostRepository;
import com.agora.forum.repository.VoteRepository;
import com.agora.forum.security.UserId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

/**
 * VoteLedger - the one-vote-per-user-per-target state machine.
 *
 * <pre>
 * current    cast  next       row
 * none       +1    up         insert +1      "Vote recorded"
 * none       -1    down       insert -1      "Vote recorded"
 * up         +1    none       delete         "Vote removed"
 * up         -1    down       update to -1   "Vote updated"
 * down       -1    none       delete         "Vote removed"
 * down       +1    up         update to +1   "Vote updated"
 * </pre>
 *
 * Posts and comments behave identically; the target kind only picks the
 * foreign key column.
 *
 * Each cast is one transaction: lock the voter's row if it exists, then
 * insert, update or delete it. When there is no row two casts can both try
 * to insert; the (user, target) unique constraint rejects one of them, and
 * that cast starts over, sees the winner's row and applies its own
 * transition on top. Retries stop after {@code forum.retry.vote-max-attempts}.
 *
 * Counts are never stored. {@link #tally} counts rows on every call, which
 * keeps them exact at the cost of one indexed count per direction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VoteLedger {

    private final VoteRepository voteRepository;
    private final PostRepository postRepository;
    private final CommentRepository commentRepository;
    private final TransactionTemplate transactionTemplate;
    private final RetryProperties retryProperties;

    /**
     * Apply one vote from {@code voter} on {@code target}.
     *
     * @throws NotFoundException if the post or comment does not exist
     * @throws TransientConflictException if every attempt lost a race
     */
    public VoteOutcome castVote(UserId voter, VoteTarget target, VoteDirection direction) {
        requireTarget(target);

        int maxAttempts = Math.max(1, retryProperties.getVoteMaxAttempts());
        RuntimeException lastConflict = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                VoteOutcome outcome = transactionTemplate.execute(status -> applyTransition(voter, target, direction));
                log.debug("User {} cast {} on {}: {}", voter, direction, target, outcome);
                return outcome;
            } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
                log.debug("Vote by user {} on {} conflicted (attempt {}/{})", voter, target, attempt, maxAttempts);
                lastConflict = e;
            }
        }
        throw new TransientConflictException("Vote could not be recorded, please retry", lastConflict);
    }

    /**
     * The voter's current direction on the target, if any.
     */
    public Optional<VoteDirection> currentVote(UserId voter, VoteTarget target) {
        Optional<Vote> vote = target.getKind() == VoteTarget.Kind.POST
                ? voteRepository.findByUserIdAndPostId(voter.getValue(), target.getId())
                : voteRepository.findByUserIdAndCommentId(voter.getValue(), target.getId());
        return vote.map(Vote::direction);
    }

    /**
     * @throws NotFoundException if the post or comment does not exist
     */
    public VoteTally tally(VoteTarget target) {
        requireTarget(target);
        if (target.getKind() == VoteTarget.Kind.POST) {
            return new VoteTally(
                    voteRepository.countByPostIdAndVoteType(target.getId(), VoteDirection.UP.getValue()),
                    voteRepository.countByPostIdAndVoteType(target.getId(), VoteDirection.DOWN.getValue()));
        }
        return new VoteTally(
                voteRepository.countByCommentIdAndVoteType(target.getId(), VoteDirection.UP.getValue()),
                voteRepository.countByCommentIdAndVoteType(target.getId(), VoteDirection.DOWN.getValue()));
    }

    private VoteOutcome applyTransition(UserId voter, VoteTarget target, VoteDirection direction) {
        Optional<Vote> existing = findForUpdate(voter, target);
        if (existing.isEmpty()) {
            voteRepository.saveAndFlush(Vote.cast(voter.getValue(), target, direction));
            return VoteOutcome.RECORDED;
        }

        Vote vote = existing.get();
        if (vote.getVoteType() == direction.getValue()) {
            voteRepository.delete(vote);
            voteRepository.flush();
            return VoteOutcome.REMOVED;
        }
        vote.setVoteType(direction.getValue());
        voteRepository.saveAndFlush(vote);
        return VoteOutcome.UPDATED;
    }

    private Optional<Vote> findForUpdate(UserId voter, VoteTarget target) {
        if (target.getKind() == VoteTarget.Kind.POST) {
            return voteRepository.findPostVoteForUpdate(voter.getValue(), target.getId());
        }
        return voteRepository.findCommentVoteForUpdate(voter.getValue(), target.getId());
    }

    private void requireTarget(VoteTarget target) {
        boolean exists = target.getKind() == VoteTarget.Kind.POST
                ? postRepository.existsById(target.getId())
                : commentRepository.existsById(target.getId());
        if (!exists) {
            throw new NotFoundException(target.getKind().getLabel() + " not found");
        }
    }
}
