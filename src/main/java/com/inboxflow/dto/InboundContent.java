package com.inboxflow.dto;

import com.inboxflow.model.MessageType;
import lombok.*;

/**
 * Normalized view of an inbound message body, whatever kind it was.
 * replyPayload is set for button/list replies and is what flow resumption parses.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class InboundContent {

    @Builder.Default
    private MessageType type = MessageType.UNKNOWN;
    private String text;
    private String mediaId;
    private String mediaMimeType;
    private String mediaCaption;
    private String mediaFilename;
    private String interactiveData;
    private String replyPayload;
}
