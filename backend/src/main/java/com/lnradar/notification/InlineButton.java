package com.lnradar.notification;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Interactive control attached to a message: either a link or a callback.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InlineButton(
        String text,
        String url,
        @JsonProperty("callback_data") String callbackData
) {

    public static InlineButton link(String text, String url) {
        return new InlineButton(text, url, null);
    }

    public static InlineButton callback(String text, String callbackData) {
        return new InlineButton(text, null, callbackData);
    }
}
