package com.mailbridge.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class OutgoingMail {

    @Builder.Default
    List<String> to = List.of();

    @Builder.Default
    List<String> cc = List.of();

    /** Delivered to, never written as a header */
    @Builder.Default
    List<String> bcc = List.of();

    String subject;

    String body;

    /** Optional HTML alternative of the body */
    String htmlBody;

    /** Local file paths */
    @Builder.Default
    List<String> attachmentPaths = List.of();
}
