package com.openonco.discovery.pipeline.digest;

import com.openonco.discovery.pipeline.model.DigestContent;

public interface DigestMailer {
    /**
     * Sends the rendered message to the configured recipients.
     *
     * @return the provider's message id
     * @throws DeliveryException when the message could not be handed off
     */
    String send(DigestContent content);
}
