package com.universalcs.routing.canonical;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Canonical, already-classified customer message as it reaches the router.
 *
 * The message is owned by the upstream ingestion pipeline. The router reads it
 * and never mutates it.
 *
 * Key points:
 * 1. Tenant-scoped: organizationId selects the rule set
 * 2. Classification is attached upstream, before routing
 * 3. metadata carries channel-specific fields reachable by custom conditions
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {
    /**
     * Unique message identifier.
     */
    @NotBlank
    private String id;

    /**
     * Conversation the message belongs to.
     */
    private String conversationId;

    /**
     * Owning tenant.
     */
    @NotBlank
    private String organizationId;

    /**
     * inbound or outbound.
     */
    private String direction;

    @Valid
    private MessageContent content;

    @Valid
    private Sender sender;

    /**
     * AI classification produced before routing. May be absent.
     */
    private Classification classification;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    private Instant createdAt;
}
