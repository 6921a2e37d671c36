package com.inboxflow.dto;

import com.inboxflow.model.MessageType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.util.List;

/**
 * Request to queue an outbound message.
 *
 * Required fields per type:
 *   TEXT      → text
 *   IMAGE     → mediaUrl (mediaCaption optional)
 *   VIDEO     → mediaUrl (mediaCaption optional)
 *   AUDIO     → mediaUrl
 *   DOCUMENT  → mediaUrl (mediaFilename, mediaCaption optional)
 *   TEMPLATE  → templateName (templateLanguage defaults to en_US, templateParams optional)
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class OutboundMessageRequest {

    @NotBlank(message = "to is required")
    private String to;

    @NotNull(message = "type is required")
    private MessageType type;

    private String text;
    private String mediaUrl;
    private String mediaCaption;
    private String mediaFilename;
    private String templateName;
    private String templateLanguage;
    private List<String> templateParams;

    // Set internally for flow-generated button messages
    private String interactiveData;
}
