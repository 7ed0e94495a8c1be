package com.strata.hierarchy.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.strata.database.session.BoundSession;
import com.strata.hierarchy.domain.ConflictException;
import com.strata.hierarchy.domain.EntityKind;
import com.strata.hierarchy.domain.ForbiddenException;
import com.strata.hierarchy.domain.Membership;
import com.strata.hierarchy.domain.NotFoundException;
import com.strata.hierarchy.domain.ValidationFailedException;
import com.strata.hierarchy.repository.MembershipRepository;
import com.strata.security.ClusterAction;
import com.strata.security.ClusterRole;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MembershipRegistry")
class MembershipRegistryTest {

    private final MembershipRepository memberships = mock(MembershipRepository.class);
    private final AuthorizationGuard guard = mock(AuthorizationGuard.class);
    private final MembershipAuditLogger audit = mock(MembershipAuditLogger.class);
    private final BoundSession session = mock(BoundSession.class);
    private final MembershipRegistry registry = new MembershipRegistry(memberships, guard, audit);
    private final UUID clusterId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        when(session.identityId()).thenReturn("alice");
        when(memberships.lockCluster(session, clusterId)).thenReturn(true);
    }

    private Membership existing(String identityId, ClusterRole role) {
        var membership =
                new Membership(UUID.randomUUID(), clusterId, identityId, role, null, null, null);
        when(memberships.find(session, clusterId, identityId)).thenReturn(Optional.of(membership));
        return membership;
    }

    private void deny(ClusterAction action) {
        when(guard.require(session, EntityKind.CLUSTER, clusterId, action))
                .thenThrow(new ForbiddenException("denied " + action.value()));
    }

    @Nested
    @DisplayName("parseRole")
    class ParseRole {

        @Test
        @DisplayName("accepts the three wire values")
        void accepts() {
            assertThat(MembershipRegistry.parseRole("owner")).isEqualTo(ClusterRole.OWNER);
            assertThat(MembershipRegistry.parseRole("admin")).isEqualTo(ClusterRole.ADMIN);
            assertThat(MembershipRegistry.parseRole("member")).isEqualTo(ClusterRole.MEMBER);
        }

        @Test
        @DisplayName("rejects blanks and unknown values as validation failures")
        void rejects() {
            assertThatThrownBy(() -> MembershipRegistry.parseRole(""))
                    .isInstanceOf(ValidationFailedException.class);
            assertThatThrownBy(() -> MembershipRegistry.parseRole("root"))
                    .isInstanceOfSatisfying(
                            ValidationFailedException.class,
                            e ->
                                    assertThat(e.fieldErrors())
                                            .containsEntry(
                                                    "role",
                                                    List.of("is not included in the list")));
        }
    }

    @Nested
    @DisplayName("addMember")
    class AddMember {

        @Test
        @DisplayName("locks the cluster before checking permissions")
        void locksFirst() {
            when(memberships.find(session, clusterId, "bob"))
                    .thenReturn(Optional.empty())
                    .thenReturn(
                            Optional.of(
                                    new Membership(
                                            UUID.randomUUID(),
                                            clusterId,
                                            "bob",
                                            ClusterRole.MEMBER,
                                            null,
                                            null,
                                            null)));

            registry.addMember(session, clusterId, "bob", ClusterRole.MEMBER, null);

            var order = inOrder(memberships, guard);
            order.verify(memberships).lockCluster(session, clusterId);
            order.verify(guard)
                    .require(session, EntityKind.CLUSTER, clusterId, ClusterAction.MANAGE_MEMBERS);
            order.verify(memberships).insert(eq(session), any(Membership.class));
            verify(audit).added(eq("alice"), any(Membership.class));
        }

        @Test
        @DisplayName("an invisible cluster is not found")
        void invisibleCluster() {
            when(memberships.lockCluster(session, clusterId)).thenReturn(false);

            assertThatThrownBy(
                            () ->
                                    registry.addMember(
                                            session, clusterId, "bob", ClusterRole.MEMBER, null))
                    .isInstanceOf(NotFoundException.class);
            verify(memberships, never()).insert(any(), any());
        }

        @Test
        @DisplayName("granting owner needs change_owner")
        void ownerGrantNeedsChangeOwner() {
            deny(ClusterAction.CHANGE_OWNER);

            assertThatThrownBy(
                            () ->
                                    registry.addMember(
                                            session, clusterId, "bob", ClusterRole.OWNER, null))
                    .isInstanceOf(ForbiddenException.class);
            verify(memberships, never()).insert(any(), any());
        }

        @Test
        @DisplayName("an existing member is a conflict")
        void duplicate() {
            existing("bob", ClusterRole.MEMBER);

            assertThatThrownBy(
                            () ->
                                    registry.addMember(
                                            session, clusterId, "bob", ClusterRole.ADMIN, null))
                    .isInstanceOf(ConflictException.class);
        }

        @Test
        @DisplayName("collects every invalid field")
        void validation() {
            assertThatThrownBy(
                            () ->
                                    registry.addMember(
                                            session, clusterId, "bad\u0000id", null, "x".repeat(1001)))
                    .isInstanceOfSatisfying(
                            ValidationFailedException.class,
                            e ->
                                    assertThat(e.fieldErrors())
                                            .containsOnlyKeys("identity_id", "role", "comment"));
        }
    }

    @Nested
    @DisplayName("owner protection")
    class OwnerProtection {

        @Test
        @DisplayName("refuses to demote the only owner")
        void lastOwnerDemotion() {
            existing("alice", ClusterRole.OWNER);
            when(memberships.countOwners(session, clusterId)).thenReturn(1L);

            assertThatThrownBy(
                            () ->
                                    registry.updateRole(
                                            session, clusterId, "alice", ClusterRole.ADMIN))
                    .isInstanceOf(ConflictException.class)
                    .hasMessageContaining("last owner");
            verify(memberships, never())
                    .update(any(), any(), anyString(), any(ClusterRole.class), any());
        }

        @Test
        @DisplayName("refuses to remove the only owner")
        void lastOwnerRemoval() {
            existing("alice", ClusterRole.OWNER);
            when(memberships.countOwners(session, clusterId)).thenReturn(1L);

            assertThatThrownBy(() -> registry.removeMember(session, clusterId, "alice"))
                    .isInstanceOf(ConflictException.class);
            verify(memberships, never()).delete(any(), any(), anyString());
        }

        @Test
        @DisplayName("removes an owner when another remains")
        void removesCoOwner() {
            Membership bob = existing("bob", ClusterRole.OWNER);
            when(memberships.countOwners(session, clusterId)).thenReturn(2L);

            registry.removeMember(session, clusterId, "bob");

            verify(memberships).delete(session, clusterId, "bob");
            verify(audit).removed("alice", bob);
        }

        @Test
        @DisplayName("a comment-only change to an owner needs no change_owner")
        void commentOnlyOwnerUpdate() {
            existing("alice", ClusterRole.OWNER);
            deny(ClusterAction.CHANGE_OWNER);

            registry.updateMember(session, clusterId, "alice", null, "founder");

            verify(memberships).update(session, clusterId, "alice", ClusterRole.OWNER, "founder");
        }

        @Test
        @DisplayName("transferring to oneself is a conflict")
        void transferToSelf() {
            assertThatThrownBy(() -> registry.transferOwnership(session, clusterId, "alice"))
                    .isInstanceOf(ConflictException.class);
        }

        @Test
        @DisplayName("transfer promotes the target and demotes the caller")
        void transfer() {
            existing("alice", ClusterRole.OWNER);
            existing("bob", ClusterRole.MEMBER);

            registry.transferOwnership(session, clusterId, "bob");

            verify(memberships).update(session, clusterId, "bob", ClusterRole.OWNER, null);
            verify(memberships).update(session, clusterId, "alice", ClusterRole.ADMIN, null);
            verify(audit).ownershipTransferred("alice", clusterId, "bob", ClusterRole.ADMIN);
        }
    }
}
