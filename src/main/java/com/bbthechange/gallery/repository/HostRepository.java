package com.bbthechange.gallery.repository;

import com.bbthechange.gallery.model.Host;
import com.bbthechange.gallery.model.HostStatus;
import com.bbthechange.gallery.util.PaginatedResult;

import java.util.Optional;

public interface HostRepository {

    Optional<Host> findById(String hostId);

    /**
     * Follow the subject link to the host it points at.
     */
    Optional<Host> findBySubjectId(String subjectId);

    /**
     * Atomically write the host together with its subject link.
     *
     * @return false if another host already claimed the subject
     */
    boolean createWithSubjectLink(Host host);

    /**
     * Overwrite profile fields of an existing host. Status and storage counters are left alone.
     */
    Host updateProfile(Host host);

    /**
     * @return false if the stored status no longer equals {@code expected}
     */
    boolean updateStatus(String hostId, HostStatus expected, HostStatus target);

    /**
     * Atomically add {@code bytes} to the host's upload counter unless that would exceed {@code quota}.
     *
     * @return false if the quota would be exceeded
     */
    boolean reserveStorage(String hostId, long bytes, long quota);

    void releaseStorage(String hostId, long bytes);

    PaginatedResult<Host> findAll(int limit, String nextToken);

    long countAll();
}
