package com.versioning.engine.persistence;

import com.versioning.core.exception.DraftAlreadyExistsException;
import com.versioning.core.model.Draft;
import com.versioning.core.model.ResourceType;
import com.versioning.core.repository.DraftRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * In-memory implementation of DraftRepository.
 * Saves are serialized so the one-modification-per-user rule holds like the
 * database's unique index does.
 */
public class InMemoryDraftRepository implements DraftRepository {

    private final Map<Long, Draft> drafts = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);

    @Override
    public synchronized Draft save(Draft draft) {
        if (draft.draftId() != null && drafts.containsKey(draft.draftId())) {
            throw new DraftAlreadyExistsException("draft", draft.draftId());
        }
        if (draft.isModification() && existsModification(draft.payload().resourceId(), draft.creatorId())) {
            throw new DraftAlreadyExistsException(draft.resourceType().dbName(), draft.payload().resourceId());
        }
        Draft stored;
        if (draft.draftId() != null) {
            nextId.accumulateAndGet(draft.draftId() + 1, Math::max);
            stored = draft;
        } else {
            stored = draft.withId(nextId.getAndIncrement());
        }
        drafts.put(stored.draftId(), stored);
        return stored;
    }

    @Override
    public boolean update(Draft draft) {
        return drafts.replace(draft.draftId(), draft) != null;
    }

    @Override
    public Optional<Draft> findById(long draftId) {
        return Optional.ofNullable(drafts.get(draftId));
    }

    @Override
    public Optional<Draft> find(long draftId, ResourceType resourceType, Long creatorId) {
        return findById(draftId)
            .filter(d -> resourceType == null || d.resourceType() == resourceType)
            .filter(d -> creatorId == null || d.creatorId() == creatorId);
    }

    @Override
    public boolean existsById(long draftId) {
        return drafts.containsKey(draftId);
    }

    @Override
    public boolean deleteById(long draftId) {
        return drafts.remove(draftId) != null;
    }

    @Override
    public Optional<Draft> findModificationByUser(long userId, long resourceId) {
        return modificationsOf(resourceId)
            .filter(d -> d.creatorId() == userId)
            .findFirst();
    }

    @Override
    public int countModifications(long resourceId, Long exceptUserId) {
        return (int) modificationsOf(resourceId)
            .filter(d -> exceptUserId == null || d.creatorId() != exceptUserId)
            .count();
    }

    @Override
    public long countByFilter(DraftFilter filter) {
        return drafts.values().stream().filter(filter::matches).count();
    }

    @Override
    public List<Draft> findByFilter(DraftFilter filter, int pageStart, int pageLength) {
        Stream<Draft> page = drafts.values().stream()
            .filter(filter::matches)
            .sorted(Comparator.comparing(Draft::draftId))
            .skip(pageStart);
        if (pageLength > 0) {
            page = page.limit(pageLength);
        }
        return page.collect(Collectors.toList());
    }

    @Override
    public Set<Long> findResourceIdsWithModifications(Collection<Long> resourceIds, Long userId) {
        Set<Long> wanted = new HashSet<>(resourceIds);
        return drafts.values().stream()
            .filter(Draft::isModification)
            .filter(d -> userId == null || d.creatorId() == userId)
            .map(d -> d.payload().resourceId())
            .filter(wanted::contains)
            .collect(Collectors.toSet());
    }

    @Override
    public boolean existsModification(long resourceId, Long userId) {
        return modificationsOf(resourceId)
            .anyMatch(d -> userId == null || d.creatorId() == userId);
    }

    private Stream<Draft> modificationsOf(long resourceId) {
        return drafts.values().stream()
            .filter(Draft::isModification)
            .filter(d -> d.payload().resourceId() == resourceId);
    }
}
