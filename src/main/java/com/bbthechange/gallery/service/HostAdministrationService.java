package com.bbthechange.gallery.service;

import com.bbthechange.gallery.dto.HostDTO;
import com.bbthechange.gallery.dto.HostDetailResponse;
import com.bbthechange.gallery.model.HostStatus;
import com.bbthechange.gallery.security.Actor;
import com.bbthechange.gallery.util.PaginatedResult;

/**
 * Admin management of host accounts. Every method requires an admin actor.
 */
public interface HostAdministrationService {

    PaginatedResult<HostDTO> listHosts(Actor actor, int limit, String nextToken);

    HostDetailResponse inspect(Actor actor, String hostId);

    /**
     * Suspend or reactivate a host with compare-and-swap on the current status.
     */
    HostDTO updateStatus(Actor actor, String hostId, HostStatus target);
}
