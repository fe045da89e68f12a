package com.agora.forum.oauth;

import lombok.Builder;
import lombok.Value;

/**
 * What a provider vouches for once its token checks out.
 */
@Value
@Builder
public class ProviderIdentity {

    /** The provider's stable user id ({@code sub}). */
    String subjectId;

    String email;

    boolean emailVerified;

    /** Profile picture URL, when the provider shares one. May be null. */
    String pictureUrl;
}
