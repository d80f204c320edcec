package com.bbthechange.gallery.testutil;

import com.bbthechange.gallery.model.Host;
import com.bbthechange.gallery.model.HostStatus;
import com.bbthechange.gallery.repository.HostRepository;
import com.bbthechange.gallery.util.PaginatedResult;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Host store with the subject-link uniqueness and quota semantics of the DynamoDB implementation.
 */
public class InMemoryHostRepository implements HostRepository {

    private final Map<String, Host> hosts = new HashMap<>();
    private final Map<String, String> subjectLinks = new HashMap<>();

    @Override
    public synchronized Optional<Host> findById(String hostId) {
        return Optional.ofNullable(hosts.get(hostId));
    }

    @Override
    public synchronized Optional<Host> findBySubjectId(String subjectId) {
        return Optional.ofNullable(subjectLinks.get(subjectId)).map(hosts::get);
    }

    @Override
    public synchronized boolean createWithSubjectLink(Host host) {
        if (subjectLinks.containsKey(host.getSubjectId())) {
            return false;
        }
        subjectLinks.put(host.getSubjectId(), host.getHostId());
        hosts.put(host.getHostId(), host);
        return true;
    }

    @Override
    public synchronized Host updateProfile(Host host) {
        hosts.put(host.getHostId(), host);
        return host;
    }

    @Override
    public synchronized boolean updateStatus(String hostId, HostStatus expected, HostStatus target) {
        Host host = hosts.get(hostId);
        if (host == null || host.getStatus() != expected) {
            return false;
        }
        host.setStatus(target);
        return true;
    }

    @Override
    public synchronized boolean reserveStorage(String hostId, long bytes, long quota) {
        Host host = hosts.get(hostId);
        if (host == null || host.getUploadedBytes() + bytes > quota) {
            return false;
        }
        host.setUploadedBytes(host.getUploadedBytes() + bytes);
        return true;
    }

    @Override
    public synchronized void releaseStorage(String hostId, long bytes) {
        Host host = hosts.get(hostId);
        if (host != null && host.getUploadedBytes() >= bytes) {
            host.setUploadedBytes(host.getUploadedBytes() - bytes);
        }
    }

    @Override
    public synchronized PaginatedResult<Host> findAll(int limit, String nextToken) {
        return new PaginatedResult<>(new ArrayList<>(hosts.values()).subList(0, Math.min(limit, hosts.size())), null);
    }

    @Override
    public synchronized long countAll() {
        return hosts.size();
    }

    public synchronized List<String> subjects() {
        return new ArrayList<>(subjectLinks.keySet());
    }
}
