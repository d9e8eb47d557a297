package com.universalcs.routing.canonical;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of a message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageContent {
    private String text;

    private String html;

    /**
     * text, html or markdown.
     */
    private String format;

    private String language;

    public static MessageContent ofText(String text) {
        return MessageContent.builder().text(text).format("text").build();
    }
}
