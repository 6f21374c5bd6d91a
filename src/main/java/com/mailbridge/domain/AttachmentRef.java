package com.mailbridge.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.mailbridge.util.EmlParser;
import jakarta.mail.MessagingException;
import jakarta.mail.Part;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.io.IOException;

/**
 * Attachment discovered while decoding a message
 */
@Value
@Builder
public class AttachmentRef {

    /** Decoded filename */
    String filename;

    /** Filename as it appeared on the wire, before RFC 2047/2231 decoding */
    String originalFilename;

    String contentType;

    /** Declared size in bytes, -1 when unknown */
    long size;

    @JsonIgnore
    @ToString.Exclude
    Part part;

    public AttachmentMetadata toMetadata() {
        return AttachmentMetadata.builder()
                .filename(filename)
                .originalFilename(originalFilename)
                .contentType(contentType)
                .size(size)
                .build();
    }

    /**
     * Read the decoded attachment bytes from the live part
     */
    public byte[] readPayload() throws MessagingException, IOException {
        if (part == null) {
            throw new IOException("Attachment handle is not available: " + filename);
        }
        return EmlParser.readPayload(part);
    }
}
