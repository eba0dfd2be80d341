package com.chatcorpus.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Reaction payload carried by {@link MessageKind#TAPBACK} messages.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TapbackInfo implements Serializable {

    private static final long serialVersionUID = 1L;

    /** loved, liked, disliked, laughed, emphasized, questioned or emoji. */
    private String type;

    /** added or removed. */
    private String action;

    private String targetMessageGuid;
    private Integer targetMessagePart;
    private String targetText;
    private Boolean isMedia;
    private String emoji;
}
