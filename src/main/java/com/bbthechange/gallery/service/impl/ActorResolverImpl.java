package com.bbthechange.gallery.service.impl;

import com.bbthechange.gallery.exception.RepositoryException;
import com.bbthechange.gallery.model.Host;
import com.bbthechange.gallery.repository.HostRepository;
import com.bbthechange.gallery.security.Actor;
import com.bbthechange.gallery.security.AdminAllowList;
import com.bbthechange.gallery.security.VerifiedIdentity;
import com.bbthechange.gallery.service.ActorResolver;
import com.bbthechange.gallery.service.NotificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class ActorResolverImpl implements ActorResolver {

    private static final Logger logger = LoggerFactory.getLogger(ActorResolverImpl.class);

    private final HostRepository hostRepository;
    private final AdminAllowList adminAllowList;
    private final NotificationService notificationService;

    @Autowired
    public ActorResolverImpl(HostRepository hostRepository, AdminAllowList adminAllowList,
                             NotificationService notificationService) {
        this.hostRepository = hostRepository;
        this.adminAllowList = adminAllowList;
        this.notificationService = notificationService;
    }

    @Override
    public Actor resolve(VerifiedIdentity identity) {
        boolean admin = adminAllowList.contains(identity.getEmail());

        Host host = hostRepository.findBySubjectId(identity.getSubjectId())
            .orElseGet(() -> createHost(identity));

        if (host.isSuspended()) {
            logger.debug("Resolved suspended host {} (admin={})", host.getHostId(), admin);
        }
        return new Actor(host, admin);
    }

    private Host createHost(VerifiedIdentity identity) {
        Host candidate = new Host(identity.getSubjectId(), identity.getEmail(), initialDisplayName(identity));

        if (hostRepository.createWithSubjectLink(candidate)) {
            notificationService.notifyHostWelcomed(candidate);
            return candidate;
        }

        // Lost a concurrent first sign-in race; attach the winner.
        return hostRepository.findBySubjectId(identity.getSubjectId())
            .orElseThrow(() -> new RepositoryException(
                "Subject " + identity.getSubjectId() + " is linked but its host cannot be read"));
    }

    private static String initialDisplayName(VerifiedIdentity identity) {
        if (identity.getDisplayName() != null && !identity.getDisplayName().isBlank()) {
            return identity.getDisplayName().trim();
        }
        String email = identity.getEmail();
        int at = email.indexOf('@');
        return at > 0 ? email.substring(0, at) : email;
    }
}
