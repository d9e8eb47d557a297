package com.universalcs.routing.canonical;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Party that sent a message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Sender {
    private String email;

    private String name;

    private String phone;

    private String userId;

    /**
     * customer, agent, system or ai.
     */
    private String type;
}
