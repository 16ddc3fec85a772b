package com.shopsense.engine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrackInteractionResponse {

    private Status status;

    /** Set when the event was stored */
    private String eventId;

    public enum Status {
        TRACKED,
        IGNORED;

        @JsonValue
        public String toJson() {
            return name().toLowerCase();
        }
    }

    public static TrackInteractionResponse tracked(String eventId) {
        return new TrackInteractionResponse(Status.TRACKED, eventId);
    }

    public static TrackInteractionResponse ignored() {
        return new TrackInteractionResponse(Status.IGNORED, null);
    }
}
