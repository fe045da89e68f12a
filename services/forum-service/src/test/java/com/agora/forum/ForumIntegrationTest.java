package com.agora.forum;

import com.agora.forum.entity.AuthProvider;
import com.agora.forum.oauth.AppleTokenVerifier;
import com.agora.forum.oauth.GoogleTokenVerifier;
import com.agora.forum.repository.CommentRepository;
import com.agora.forum.repository.PostRepository;
import com.agora.forum.repository.UserRepository;
import com.agora.forum.repository.VoteRepository;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import static org.mockito.Mockito.when;

/**
 * Base for tests that run against the full application on H2.
 *
 * All subclasses share one application context (same mocks, same
 * properties), so the in-memory schema is created once. Tables are emptied
 * before every test.
 */
@SpringBootTest
@AutoConfigureMockMvc
public abstract class ForumIntegrationTest {

    @MockBean
    protected GoogleTokenVerifier googleTokenVerifier;

    @MockBean
    protected AppleTokenVerifier appleTokenVerifier;

    @Autowired
    protected UserRepository userRepository;

    @Autowired
    protected VoteRepository voteRepository;

    @Autowired
    protected PostRepository postRepository;

    @Autowired
    protected CommentRepository commentRepository;

    @BeforeEach
    void resetState() {
        voteRepository.deleteAll();
        commentRepository.deleteAll();
        postRepository.deleteAll();
        userRepository.deleteAll();
        when(googleTokenVerifier.provider()).thenReturn(AuthProvider.GOOGLE);
        when(appleTokenVerifier.provider()).thenReturn(AuthProvider.APPLE);
    }
}
