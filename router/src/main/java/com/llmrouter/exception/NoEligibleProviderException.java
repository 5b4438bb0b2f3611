package com.llmrouter.exception;

import com.llmrouter.model.MediaType;
import lombok.Getter;

@Getter
public class NoEligibleProviderException extends LlmRoutingException {

    private final MediaType mediaType;

    public NoEligibleProviderException(MediaType mediaType) {
        super(ErrorCategory.NO_ELIGIBLE_PROVIDER,
                "No active provider supports media type '" + mediaType.getValue() + "'");
        this.mediaType = mediaType;
    }
}
