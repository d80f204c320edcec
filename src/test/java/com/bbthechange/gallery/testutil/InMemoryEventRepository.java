package com.bbthechange.gallery.testutil;

import com.bbthechange.gallery.model.Event;
import com.bbthechange.gallery.model.EventStatus;
import com.bbthechange.gallery.repository.EventRepository;
import com.bbthechange.gallery.util.PaginatedResult;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Event store with the same compare-and-swap semantics as the DynamoDB implementation.
 * Reads return copies so callers cannot change stored state without a conditional write.
 */
public class InMemoryEventRepository implements EventRepository {

    private static final TableSchema<Event> SCHEMA = TableSchema.fromBean(Event.class);

    private final Map<String, Event> events = new ConcurrentHashMap<>();
    private InMemoryPhotoRepository photoRepository;

    void attach(InMemoryPhotoRepository photoRepository) {
        this.photoRepository = photoRepository;
    }

    @Override
    public void create(Event event) {
        events.put(event.getEventId(), copy(event));
    }

    @Override
    public Optional<Event> findById(String eventId) {
        return Optional.ofNullable(events.get(eventId)).map(InMemoryEventRepository::copy);
    }

    @Override
    public Optional<Event> findByShareToken(String shareToken) {
        return events.values().stream()
            .filter(e -> e.getShareToken().equals(shareToken))
            .findFirst()
            .map(InMemoryEventRepository::copy);
    }

    @Override
    public boolean shareTokenExists(String shareToken) {
        return events.values().stream().anyMatch(e -> e.getShareToken().equals(shareToken));
    }

    @Override
    public PaginatedResult<Event> findByHostId(String hostId, boolean includeDeleted, int limit, String nextToken) {
        List<Event> owned = events.values().stream()
            .filter(e -> e.isOwnedBy(hostId))
            .filter(e -> includeDeleted || e.getStatus() != EventStatus.DELETED)
            .sorted(Comparator.comparing(Event::getCreatedAt).reversed())
            .limit(limit)
            .map(InMemoryEventRepository::copy)
            .collect(Collectors.toList());
        return new PaginatedResult<>(owned, null);
    }

    @Override
    public synchronized boolean transitionStatus(String eventId, EventStatus expected, EventStatus target) {
        Event stored = events.get(eventId);
        if (stored == null || stored.getStatus() != expected) {
            return false;
        }
        stored.setStatus(target);
        stored.touch();
        return true;
    }

    @Override
    public synchronized boolean updateMetadata(String eventId, EventStatus expected, Map<String, AttributeValue> updates) {
        Event stored = events.get(eventId);
        if (stored == null || stored.getStatus() != expected) {
            return false;
        }
        Map<String, AttributeValue> item = new HashMap<>(SCHEMA.itemToMap(stored, true));
        updates.forEach((name, value) -> {
            if (Boolean.TRUE.equals(value.nul())) {
                item.remove(name);
            } else {
                item.put(name, value);
            }
        });
        Event updated = SCHEMA.mapToItem(item);
        updated.touch();
        events.put(eventId, updated);
        return true;
    }

    @Override
    public synchronized Optional<List<String>> forceDelete(String eventId, EventStatus expected) {
        Event stored = events.get(eventId);
        if (stored == null || stored.getStatus() != expected) {
            return Optional.empty();
        }
        events.remove(eventId);
        List<String> refs = photoRepository == null ? new ArrayList<>() : photoRepository.purge(eventId);
        return Optional.of(refs);
    }

    @Override
    public PaginatedResult<Event> findAll(EventStatus statusFilter, int limit, String nextToken) {
        List<Event> all = events.values().stream()
            .filter(e -> statusFilter == null || e.getStatus() == statusFilter)
            .limit(limit)
            .map(InMemoryEventRepository::copy)
            .collect(Collectors.toList());
        return new PaginatedResult<>(all, null);
    }

    @Override
    public Map<EventStatus, Long> countByStatus() {
        Map<EventStatus, Long> counts = new EnumMap<>(EventStatus.class);
        events.values().forEach(e -> counts.merge(e.getStatus(), 1L, Long::sum));
        return counts;
    }

    /**
     * Current stored status, or null when the event is gone.
     */
    public EventStatus statusOf(String eventId) {
        Event stored = events.get(eventId);
        return stored == null ? null : stored.getStatus();
    }

    static Event copy(Event source) {
        Event copy = new Event();
        copy.setPk(source.getPk());
        copy.setSk(source.getSk());
        copy.setGsi1pk(source.getGsi1pk());
        copy.setGsi1sk(source.getGsi1sk());
        copy.setGsi2pk(source.getGsi2pk());
        copy.setCreatedAt(source.getCreatedAt());
        copy.setUpdatedAt(source.getUpdatedAt());
        copy.setEventId(source.getEventId());
        copy.setHostId(source.getHostId());
        copy.setTitle(source.getTitle());
        copy.setDescription(source.getDescription());
        copy.setEventDate(source.getEventDate());
        copy.setStatus(source.getStatus());
        copy.setAccessPasswordHash(source.getAccessPasswordHash());
        copy.setShareToken(source.getShareToken());
        copy.setCoverImageRef(source.getCoverImageRef());
        return copy;
    }
}
