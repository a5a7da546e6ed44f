package com.bbthechange.activityfeed.service;

import com.bbthechange.activityfeed.model.EmailDigest;

/**
 * Hands finished digests to the mail renderer.
 */
public interface EmailDigestSink {

    /**
     * @throws RuntimeException if the digest could not be handed off; the recipient's records are kept
     */
    void send(EmailDigest digest);
}
