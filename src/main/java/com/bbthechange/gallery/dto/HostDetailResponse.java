package com.bbthechange.gallery.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Admin view of one host with its most recent events.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HostDetailResponse {
    private HostDTO host;
    private List<EventDTO> recentEvents;
    private boolean moreEvents;
}
