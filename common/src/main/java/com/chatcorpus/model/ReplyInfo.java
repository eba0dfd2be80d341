package com.chatcorpus.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Reply association of a message to an earlier one.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReplyInfo implements Serializable {

    private static final long serialVersionUID = 1L;

    private String sender;
    private String date;
    private String text;
    private String targetMessageGuid;
}
