package com.browserswarm.automation;

public record ImageAttachment(
        byte[] data,
        String mimeType
) {
}
