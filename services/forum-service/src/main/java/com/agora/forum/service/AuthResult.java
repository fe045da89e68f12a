package com.agora.forum.service;

import com.agora.forum.entity.User;
import lombok.Value;

/**
 * Outcome of a successful authentication: the resolved account (after any
 * creation or linking) and the session token minted for it.
 */
@Value
public class AuthResult {

    public enum Outcome {
        NEW_LOCAL_ACCOUNT,
        EXISTING_LOCAL_LOGIN,
        NEW_FEDERATED_ACCOUNT,
        LINKED_FEDERATED_ACCOUNT
    }

    User user;
    String token;
    Outcome outcome;
}
