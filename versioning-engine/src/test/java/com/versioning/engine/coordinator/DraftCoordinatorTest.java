package com.versioning.engine.coordinator;

import com.versioning.core.exception.*;
import com.versioning.core.model.*;
import com.versioning.engine.metrics.VersioningMetrics;
import com.versioning.engine.service.DraftService.DraftPage;
import com.versioning.engine.service.DraftService.DraftQuery;
import com.versioning.engine.service.ResourceService.SnapshotRequest;
import com.versioning.engine.test.InMemoryStack;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Draft lifecycle over the in-memory stores.
 */
class DraftCoordinatorTest {

    private static final long GROUP = 1L;
    private static final long OTHER_GROUP = 2L;
    private static final long ALICE = 10L;
    private static final long BOB = 11L;
    private static final long CAROL = 12L;

    private InMemoryStack stack;
    private DraftCoordinator drafts;
    private ResourceSnapshot queueV1;
    private long queueId;

    @BeforeEach
    void setUp() {
        stack = new InMemoryStack()
            .member(ALICE, GROUP)
            .member(BOB, GROUP)
            .member(CAROL, OTHER_GROUP);
        drafts = stack.drafts();

        queueV1 = stack.resource(ResourceType.QUEUE, GROUP, ALICE, null);
        queueId = queueV1.resourceId();
    }

    private Draft newQueueDraft(long creatorId, Long baseResourceId) {
        return Draft.newResource(ResourceType.QUEUE, GROUP, creatorId,
            stack.data("draft"), baseResourceId, stack.time().instant());
    }

    private Draft modificationOf(long resourceId, long snapshotId, long creatorId, long groupId) {
        return Draft.modification(ResourceType.QUEUE, groupId, creatorId,
            stack.data("edit"), resourceId, snapshotId, stack.time().instant());
    }

    @Nested
    @DisplayName("createDraftResource")
    class CreateDraftResource {

        @Test
        @DisplayName("A member's draft resource is stored and listed")
        void shouldStoreAndList() {
            Draft stored = drafts.createDraftResource(newQueueDraft(ALICE, null));

            assertThat(stored.draftId()).isNotNull();
            assertThat(stored.createdOn()).isEqualTo(InMemoryStack.START);

            DraftPage page = drafts.getByFiltersPaged(DraftQuery.all(DraftType.RESOURCE, ResourceType.QUEUE, ALICE));
            assertThat(page.totalCount()).isEqualTo(1);
            assertThat(page.drafts()).containsExactly(stored);
        }

        @Test
        @DisplayName("Non-members are rejected with a membership violation")
        void shouldRejectNonMember() {
            assertThatThrownBy(() -> drafts.createDraftResource(newQueueDraft(CAROL, null)))
                .isInstanceOf(UserNotInGroupException.class)
                .extracting(e -> ((VersioningException) e).getKind())
                .isEqualTo(ErrorKind.MEMBERSHIP_VIOLATION);
        }

        @Test
        @DisplayName("Unknown creators and deleted groups are rejected")
        void shouldRejectMissingUserAndDeletedGroup() {
            Draft unknownUser = Draft.newResource(ResourceType.QUEUE, GROUP, 999L, null, null, Instant.EPOCH);
            assertThatThrownBy(() -> drafts.createDraftResource(unknownUser))
                .isInstanceOf(EntityDoesNotExistException.class);

            stack.directory().deleteGroup(GROUP);
            assertThatThrownBy(() -> drafts.createDraftResource(newQueueDraft(ALICE, null)))
                .isInstanceOf(EntityDeletedException.class)
                .hasMessageContaining("group");
        }

        @Test
        @DisplayName("A deleted base fails as deleted whether or not the type pair is legal")
        void shouldRejectDeletedBaseRegardlessOfLegality() {
            long entryPoint = stack.resource(ResourceType.ENTRY_POINT, GROUP, ALICE, null).resourceId();
            long experiment = stack.resource(ResourceType.EXPERIMENT, GROUP, ALICE, null).resourceId();
            stack.resources().deleteResource(entryPoint);
            stack.resources().deleteResource(experiment);

            Draft legalPair = newQueueDraft(ALICE, entryPoint);
            Draft illegalPair = newQueueDraft(ALICE, experiment);

            assertThatThrownBy(() -> drafts.createDraftResource(legalPair))
                .isInstanceOf(EntityDeletedException.class);
            assertThatThrownBy(() -> drafts.createDraftResource(illegalPair))
                .isInstanceOf(EntityDeletedException.class);
        }

        @Test
        @DisplayName("A job cannot be based directly on an experiment")
        void shouldRejectIllegalBaseType() {
            long experiment = stack.resource(ResourceType.EXPERIMENT, GROUP, ALICE, null).resourceId();
            Draft job = Draft.newResource(ResourceType.JOB, GROUP, ALICE,
                stack.data("job"), experiment, stack.time().instant());

            assertThatThrownBy(() -> drafts.createDraftResource(job))
                .isInstanceOf(DraftBaseInvalidException.class)
                .satisfies(e -> {
                    DraftBaseInvalidException error = (DraftBaseInvalidException) e;
                    assertThat(error.getKind()).isEqualTo(ErrorKind.INVALID_RELATIONSHIP);
                    assertThat(error.getParentType()).isEqualTo("experiment");
                    assertThat(error.getChildType()).isEqualTo("job");
                });
        }

        @Test
        @DisplayName("A job based on an entry point is accepted and searchable by base")
        void shouldAcceptLegalBase() {
            long entryPoint = stack.resource(ResourceType.ENTRY_POINT, GROUP, ALICE, null).resourceId();
            Draft job = drafts.createDraftResource(Draft.newResource(ResourceType.JOB, GROUP, ALICE,
                stack.data("job"), entryPoint, stack.time().instant()));

            DraftPage byBase = drafts.getByFiltersPaged(
                new DraftQuery(DraftType.ANY, ResourceType.JOB, ALICE, null, entryPoint, 0, 0));
            DraftPage otherBase = drafts.getByFiltersPaged(
                new DraftQuery(DraftType.ANY, ResourceType.JOB, ALICE, null, queueId, 0, 0));

            assertThat(byBase.drafts()).containsExactly(job);
            assertThat(otherBase.totalCount()).isZero();
        }

        @Test
        @DisplayName("A base id that names no resource is not found")
        void shouldRejectMissingBase() {
            assertThatThrownBy(() -> drafts.createDraftResource(newQueueDraft(ALICE, 404L)))
                .isInstanceOf(EntityDoesNotExistException.class);
        }

        @Test
        @DisplayName("Several draft resources may share a base")
        void shouldAllowCompetingProposals() {
            long entryPoint = stack.resource(ResourceType.ENTRY_POINT, GROUP, ALICE, null).resourceId();

            drafts.createDraftResource(Draft.newResource(ResourceType.JOB, GROUP, ALICE,
                stack.data("a"), entryPoint, stack.time().instant()));
            drafts.createDraftResource(Draft.newResource(ResourceType.JOB, GROUP, ALICE,
                stack.data("b"), entryPoint, stack.time().instant()));

            assertThat(drafts.getByFiltersPaged(
                new DraftQuery(DraftType.RESOURCE, ResourceType.JOB, ALICE, GROUP, entryPoint, 0, 0)).totalCount())
                .isEqualTo(2);
        }

        @Test
        @DisplayName("A modification payload is malformed for a draft resource")
        void shouldRejectModificationPayload() {
            assertThatThrownBy(() -> drafts.createDraftResource(
                    modificationOf(queueId, queueV1.snapshotId(), ALICE, GROUP)))
                .isInstanceOf(MalformedDraftException.class);
        }

        @Test
        @DisplayName("A draft id that is already taken is a duplicate")
        void shouldRejectTakenDraftId() {
            Draft stored = drafts.createDraftResource(newQueueDraft(ALICE, null));

            assertThatThrownBy(() -> drafts.createDraftResource(newQueueDraft(ALICE, null).withId(stored.draftId())))
                .isInstanceOf(DraftAlreadyExistsException.class);
        }
    }

    @Nested
    @DisplayName("createDraftModification")
    class CreateDraftModification {

        @Test
        @DisplayName("A member may draft a modification pinned to a snapshot of the resource")
        void shouldCreateModification() {
            Draft stored = drafts.createDraftModification(modificationOf(queueId, queueV1.snapshotId(), ALICE, GROUP));

            assertThat(stored.isModification()).isTrue();
            assertThat(drafts.getDraftModificationByUser(ALICE, queueId)).contains(stored);
        }

        @Test
        @DisplayName("A second modification by the same user fails and leaves the first unchanged")
        void shouldRejectSecondModificationBySameUser() {
            Draft first = drafts.createDraftModification(modificationOf(queueId, queueV1.snapshotId(), ALICE, GROUP));
            Draft second = Draft.modification(ResourceType.QUEUE, GROUP, ALICE,
                stack.data("something else"), queueId, queueV1.snapshotId(), stack.time().instant());

            assertThatThrownBy(() -> drafts.createDraftModification(second))
                .isInstanceOf(DraftAlreadyExistsException.class)
                .extracting(e -> ((VersioningException) e).getKind())
                .isEqualTo(ErrorKind.DUPLICATE);

            assertThat(drafts.getOne(first.draftId(), null, null)).isEqualTo(first);
            assertThat(drafts.getNumDraftModifications(queueId, null)).isEqualTo(1);
        }

        @Test
        @DisplayName("Different users may each hold a modification of the same resource")
        void shouldAllowOneModificationPerUser() {
            drafts.createDraftModification(modificationOf(queueId, queueV1.snapshotId(), ALICE, GROUP));
            drafts.createDraftModification(modificationOf(queueId, queueV1.snapshotId(), BOB, GROUP));

            assertThat(drafts.getNumDraftModifications(queueId, null)).isEqualTo(2);
            assertThat(drafts.getNumDraftModifications(queueId, ALICE)).isEqualTo(1);
        }

        @Test
        @DisplayName("A deleted resource cannot be drafted against")
        void shouldRejectDeletedResource() {
            stack.resources().deleteResource(queueId);

            assertThatThrownBy(() -> drafts.createDraftModification(
                    modificationOf(queueId, queueV1.snapshotId(), BOB, GROUP)))
                .isInstanceOf(EntityDeletedException.class)
                .extracting(e -> ((VersioningException) e).getKind())
                .isEqualTo(ErrorKind.DELETED_ENTITY);
        }

        @Test
        @DisplayName("A read-only resource cannot be drafted against")
        void shouldRejectReadOnlyResource() {
            stack.resources().markReadOnly(queueId);

            assertThatThrownBy(() -> drafts.createDraftModification(
                    modificationOf(queueId, queueV1.snapshotId(), ALICE, GROUP)))
                .isInstanceOf(ReadOnlyLockException.class)
                .extracting(e -> ((VersioningException) e).getKind())
                .isEqualTo(ErrorKind.LOCKED);
        }

        @Test
        @DisplayName("A modification must carry the type of the resource it targets")
        void shouldRejectMismatchedResourceType() {
            Draft wrongType = Draft.modification(ResourceType.EXPERIMENT, GROUP, ALICE,
                stack.data("edit"), queueId, queueV1.snapshotId(), stack.time().instant());

            assertThatThrownBy(() -> drafts.createDraftModification(wrongType))
                .isInstanceOf(MismatchedResourceTypeException.class)
                .extracting(e -> ((VersioningException) e).getKind())
                .isEqualTo(ErrorKind.INVALID_RELATIONSHIP);

            assertThat(drafts.getNumDraftModifications(queueId, null)).isZero();
            assertThat(drafts.hasDraftModification(queueId, ALICE)).isFalse();
        }

        @Test
        @DisplayName("The pinned snapshot must exist and belong to the resource")
        void shouldRejectForeignOrMissingSnapshot() {
            ResourceSnapshot otherQueue = stack.resource(ResourceType.QUEUE, GROUP, ALICE, null);

            assertThatThrownBy(() -> drafts.createDraftModification(
                    modificationOf(queueId, otherQueue.snapshotId(), ALICE, GROUP)))
                .isInstanceOf(DraftSnapshotIdInvalidException.class);
            assertThatThrownBy(() -> drafts.createDraftModification(
                    modificationOf(queueId, 777L, ALICE, GROUP)))
                .isInstanceOf(EntityDoesNotExistException.class);
        }

        @Test
        @DisplayName("Ownership cannot move to another group through a draft")
        void shouldRejectOwnerMismatch() {
            assertThatThrownBy(() -> drafts.createDraftModification(
                    modificationOf(queueId, queueV1.snapshotId(), CAROL, OTHER_GROUP)))
                .isInstanceOf(DraftTargetOwnerMismatchException.class)
                .satisfies(e -> {
                    DraftTargetOwnerMismatchException error = (DraftTargetOwnerMismatchException) e;
                    assertThat(error.getDraftOwnerId()).isEqualTo(OTHER_GROUP);
                    assertThat(error.getResourceOwnerId()).isEqualTo(GROUP);
                });
        }

        @Test
        @DisplayName("A missing target resource is not found")
        void shouldRejectMissingResource() {
            assertThatThrownBy(() -> drafts.createDraftModification(modificationOf(555L, 1L, ALICE, GROUP)))
                .isInstanceOf(EntityDoesNotExistException.class);
        }
    }

    @Nested
    @DisplayName("Retrieval")
    class Retrieval {

        @Test
        @DisplayName("Filters hide a draft of the wrong type or creator")
        void filtersShouldHideDraft() {
            Draft stored = drafts.createDraftResource(newQueueDraft(ALICE, null));

            assertThat(drafts.get(stored.draftId(), null, null)).contains(stored);
            assertThat(drafts.get(stored.draftId(), ResourceType.QUEUE, ALICE)).contains(stored);
            assertThat(drafts.get(stored.draftId(), ResourceType.JOB, null)).isEmpty();
            assertThat(drafts.get(stored.draftId(), null, BOB)).isEmpty();

            assertThatThrownBy(() -> drafts.getOne(stored.draftId(), null, BOB))
                .isInstanceOf(DraftDoesNotExistException.class);
        }

        @Test
        @DisplayName("A creator filter naming an unknown user fails")
        void creatorFilterShouldRequireUser() {
            Draft stored = drafts.createDraftResource(newQueueDraft(ALICE, null));

            assertThatThrownBy(() -> drafts.get(stored.draftId(), null, 999L))
                .isInstanceOf(EntityDoesNotExistException.class);
        }

        @Test
        @DisplayName("Resources are filtered by deletion policy")
        void getResourceShouldApplyDeletionPolicy() {
            assertThat(drafts.getResource(queueId, DeletionPolicy.NOT_DELETED)).isPresent();
            assertThat(drafts.getResource(queueId, DeletionPolicy.DELETED)).isEmpty();

            stack.resources().deleteResource(queueId);

            assertThat(drafts.getResource(queueId, DeletionPolicy.NOT_DELETED)).isEmpty();
            assertThat(drafts.getResource(queueId, DeletionPolicy.DELETED)).isPresent();
            assertThat(drafts.getResource(queueId, DeletionPolicy.ANY))
                .hasValueSatisfying(r -> assertThat(r.deleted()).isTrue());
        }

        @Test
        @DisplayName("Counting modifications of a deleted resource fails")
        void countShouldRequireLiveResource() {
            stack.resources().deleteResource(queueId);

            assertThatThrownBy(() -> drafts.getNumDraftModifications(queueId, null))
                .isInstanceOf(EntityDeletedException.class);
            assertThatThrownBy(() -> drafts.getDraftModificationByUser(ALICE, queueId))
                .isInstanceOf(EntityDeletedException.class);
        }

        @Test
        @DisplayName("Only resources with a modification are reported")
        void hasDraftModificationsShouldReturnSubset() {
            long q1 = queueId;
            ResourceSnapshot q2 = stack.resource(ResourceType.QUEUE, GROUP, ALICE, null);
            long q3 = stack.resource(ResourceType.QUEUE, GROUP, ALICE, null).resourceId();
            drafts.createDraftModification(modificationOf(q2.resourceId(), q2.snapshotId(), BOB, GROUP));

            assertThat(drafts.hasDraftModifications(List.of(q1, q2.resourceId(), q3), null))
                .containsExactly(q2.resourceId());
            assertThat(drafts.hasDraftModifications(List.of(q1, q2.resourceId(), q3), ALICE)).isEmpty();
            assertThat(drafts.hasDraftModifications(List.of(), null)).isEmpty();
            assertThat(drafts.hasDraftModification(q2.resourceId(), BOB)).isTrue();
            assertThat(drafts.hasDraftModification(q1, null)).isFalse();
        }
    }

    @Nested
    @DisplayName("getByFiltersPaged")
    class Paging {

        @Test
        @DisplayName("Pages are ordered by draft id and carry the total count")
        void shouldPageInIdOrder() {
            List<Long> ids = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                ids.add(drafts.createDraftResource(newQueueDraft(ALICE, null)).draftId());
            }

            DraftPage page = drafts.getByFiltersPaged(
                new DraftQuery(DraftType.ANY, ResourceType.QUEUE, ALICE, null, null, 1, 2));
            DraftPage unbounded = drafts.getByFiltersPaged(
                new DraftQuery(DraftType.ANY, ResourceType.QUEUE, ALICE, null, null, 0, 0));

            assertThat(page.totalCount()).isEqualTo(5);
            assertThat(page.drafts()).extracting(Draft::draftId).containsExactly(ids.get(1), ids.get(2));
            assertThat(unbounded.drafts()).extracting(Draft::draftId).containsExactlyElementsOf(ids);
        }

        @Test
        @DisplayName("RESOURCE and MODIFICATION partition ANY")
        void draftTypesShouldPartition() {
            drafts.createDraftResource(newQueueDraft(ALICE, null));
            drafts.createDraftResource(newQueueDraft(ALICE, null));
            drafts.createDraftModification(modificationOf(queueId, queueV1.snapshotId(), ALICE, GROUP));

            Set<Long> resources = idsOf(DraftType.RESOURCE);
            Set<Long> modifications = idsOf(DraftType.MODIFICATION);
            Set<Long> all = idsOf(DraftType.ANY);

            assertThat(resources).hasSize(2).doesNotContainAnyElementsOf(modifications);
            assertThat(modifications).hasSize(1);
            Set<Long> union = new HashSet<>(resources);
            union.addAll(modifications);
            assertThat(all).isEqualTo(union);

            DraftQuery modificationQuery = DraftQuery.all(DraftType.MODIFICATION, ResourceType.QUEUE, ALICE);
            assertThat(drafts.getByFiltersPaged(modificationQuery).drafts())
                .allSatisfy(d -> assertThat(d.payload().resourceId()).isNotNull());
        }

        @Test
        @DisplayName("Search criteria must name live entities")
        void shouldValidateCriteria() {
            assertThatThrownBy(() -> drafts.getByFiltersPaged(DraftQuery.all(DraftType.ANY, ResourceType.QUEUE, 999L)))
                .isInstanceOf(EntityDoesNotExistException.class);
            assertThatThrownBy(() -> drafts.getByFiltersPaged(
                    new DraftQuery(DraftType.ANY, ResourceType.QUEUE, ALICE, 99L, null, 0, 0)))
                .isInstanceOf(EntityDoesNotExistException.class);

            stack.resources().deleteResource(queueId);
            assertThatThrownBy(() -> drafts.getByFiltersPaged(
                    new DraftQuery(DraftType.ANY, ResourceType.QUEUE, ALICE, null, queueId, 0, 0)))
                .isInstanceOf(EntityDeletedException.class);
        }

        private Set<Long> idsOf(DraftType type) {
            return drafts.getByFiltersPaged(DraftQuery.all(type, ResourceType.QUEUE, ALICE)).drafts().stream()
                .map(Draft::draftId)
                .collect(Collectors.toSet());
        }
    }

    @Nested
    @DisplayName("update and delete")
    class UpdateAndDelete {

        @Test
        @DisplayName("Updating replaces the data and refreshes the modification time")
        void shouldReplaceDataAndTouch() {
            Draft stored = drafts.createDraftResource(newQueueDraft(ALICE, null));
            stack.time().advanceMinutes(5);

            Draft updated = drafts.update(stored, stack.data("renamed"), null);

            assertThat(updated.payload().resourceData().get("name").asText()).isEqualTo("renamed");
            assertThat(updated.lastModifiedOn()).isEqualTo(InMemoryStack.START.plusSeconds(300));
            assertThat(updated.createdOn()).isEqualTo(InMemoryStack.START);
            assertThat(drafts.getOne(stored.draftId(), null, null)).isEqualTo(updated);
        }

        @Test
        @DisplayName("Re-pinning a draft resource requires a modification")
        void shouldRejectSnapshotChangeOnDraftResource() {
            Draft stored = drafts.createDraftResource(newQueueDraft(ALICE, null));

            assertThatThrownBy(() -> drafts.update(stored.draftId(), stack.data("x"), queueV1.snapshotId()))
                .isInstanceOf(DraftModificationRequiredException.class)
                .extracting(e -> ((VersioningException) e).getKind())
                .isEqualTo(ErrorKind.INVALID_RELATIONSHIP);
        }

        @Test
        @DisplayName("Re-pinning to another resource's snapshot fails and keeps the old pin")
        void shouldRejectForeignSnapshot() {
            Draft stored = drafts.createDraftModification(modificationOf(queueId, queueV1.snapshotId(), ALICE, GROUP));
            ResourceSnapshot otherQueue = stack.resource(ResourceType.QUEUE, GROUP, ALICE, null);

            assertThatThrownBy(() -> drafts.update(stored, stack.data("x"), otherQueue.snapshotId()))
                .isInstanceOf(DraftSnapshotIdInvalidException.class);

            Draft reloaded = drafts.getOne(stored.draftId(), null, null);
            assertThat(reloaded.payload().resourceSnapshotId()).isEqualTo(queueV1.snapshotId());
            assertThat(reloaded.payload().resourceData()).isEqualTo(stored.payload().resourceData());
        }

        @Test
        @DisplayName("Re-pinning to a newer snapshot of the same resource succeeds")
        void shouldRepinToNewerSnapshot() {
            Draft stored = drafts.createDraftModification(modificationOf(queueId, queueV1.snapshotId(), ALICE, GROUP));
            ResourceSnapshot queueV2 = stack.resources().commitSnapshot(
                new SnapshotRequest(queueId, ResourceType.QUEUE, BOB, stack.data("v2"), "second"));

            Draft updated = drafts.update(stored.draftId(), stack.data("rebased"), queueV2.snapshotId());

            assertThat(updated.payload().resourceSnapshotId()).isEqualTo(queueV2.snapshotId());
            assertThat(updated.payload().resourceId()).isEqualTo(queueId);
        }

        @Test
        @DisplayName("Updating a missing draft fails")
        void shouldRejectMissingDraftOnUpdate() {
            assertThatThrownBy(() -> drafts.update(42L, stack.data("x"), null))
                .isInstanceOf(DraftDoesNotExistException.class);
        }

        @Test
        @DisplayName("Deleting twice fails the second time")
        void shouldRejectSecondDelete() {
            Draft stored = drafts.createDraftResource(newQueueDraft(ALICE, null));

            drafts.delete(stored);

            assertThat(drafts.get(stored.draftId(), null, null)).isEmpty();
            assertThatThrownBy(() -> drafts.delete(stored.draftId()))
                .isInstanceOf(DraftDoesNotExistException.class);
        }
    }

    @Test
    @DisplayName("Rejections are counted by error code")
    void rejectionsShouldBeCounted() {
        assertThatThrownBy(() -> drafts.createDraftResource(newQueueDraft(CAROL, null)))
            .isInstanceOf(UserNotInGroupException.class);

        double rejected = stack.meterRegistry().get(VersioningMetrics.REJECTIONS)
            .tag("error_code", UserNotInGroupException.ERROR_CODE)
            .counter()
            .count();
        assertThat(rejected).isEqualTo(1.0);
    }
}
