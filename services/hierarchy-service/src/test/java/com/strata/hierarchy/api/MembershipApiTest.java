package com.strata.hierarchy.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Membership API")
class MembershipApiTest extends HierarchyApiSupport {

    @Nested
    @DisplayName("adding members")
    class Adding {

        @Test
        @DisplayName("owner adds a member with a comment")
        void ownerAddsMember() throws Exception {
            String alice = newIdentity("alice");
            String bob = newIdentity("bob");
            UUID alpha = createCluster(alice, "Alpha");

            mockMvc.perform(
                            json(
                                            post("/api/v1/clusters/{id}/members", alpha),
                                            Map.of(
                                                    "identity_id", bob,
                                                    "role", "member",
                                                    "comment", "analyst"))
                                    .with(as(alice)))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.data.identity_id").value(bob))
                    .andExpect(jsonPath("$.data.role").value("member"))
                    .andExpect(jsonPath("$.data.comment").value("analyst"))
                    .andExpect(jsonPath("$.data.cluster_id").value(alpha.toString()));
        }

        @Test
        @DisplayName("adding an existing member is a conflict")
        void duplicateMember() throws Exception {
            String alice = newIdentity("alice");
            String bob = newIdentity("bob");
            UUID alpha = createCluster(alice, "Alpha");
            addMember(alice, alpha, bob, "member");

            mockMvc.perform(
                            json(
                                            post("/api/v1/clusters/{id}/members", alpha),
                                            Map.of("identity_id", bob, "role", "admin"))
                                    .with(as(alice)))
                    .andExpect(status().isConflict());
        }

        @Test
        @DisplayName("rejects unknown roles and blank identities with 422")
        void rejectsInvalidInput() throws Exception {
            String alice = newIdentity("alice");
            UUID alpha = createCluster(alice, "Alpha");

            mockMvc.perform(
                            json(
                                            post("/api/v1/clusters/{id}/members", alpha),
                                            Map.of("identity_id", "bob", "role", "superuser"))
                                    .with(as(alice)))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(
                            jsonPath("$.field_errors.role[0]").value("is not included in the list"));
            mockMvc.perform(
                            json(
                                            post("/api/v1/clusters/{id}/members", alpha),
                                            Map.of("identity_id", " ", "role", "member"))
                                    .with(as(alice)))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.field_errors.identity_id").exists());
        }

        @Test
        @DisplayName("plain members cannot add anyone")
        void memberCannotAdd() throws Exception {
            String alice = newIdentity("alice");
            String bob = newIdentity("bob");
            UUID alpha = createCluster(alice, "Alpha");
            addMember(alice, alpha, bob, "member");

            mockMvc.perform(
                            json(
                                            post("/api/v1/clusters/{id}/members", alpha),
                                            Map.of("identity_id", newIdentity("eve"), "role", "member"))
                                    .with(as(bob)))
                    .andExpect(status().isForbidden());
        }

        @Test
        @DisplayName("admins cannot grant the owner role")
        void adminCannotGrantOwner() throws Exception {
            String alice = newIdentity("alice");
            String carol = newIdentity("carol");
            UUID alpha = createCluster(alice, "Alpha");
            addMember(alice, alpha, carol, "admin");

            mockMvc.perform(
                            json(
                                            post("/api/v1/clusters/{id}/members", alpha),
                                            Map.of("identity_id", newIdentity("dave"), "role", "owner"))
                                    .with(as(carol)))
                    .andExpect(status().isForbidden());
            addMember(carol, alpha, newIdentity("dave"), "member");
        }

        @Test
        @DisplayName("non-members get 404, not 403")
        void nonMemberGetsNotFound() throws Exception {
            UUID alpha = createCluster(newIdentity("alice"), "Alpha");

            mockMvc.perform(
                            json(
                                            post("/api/v1/clusters/{id}/members", alpha),
                                            Map.of("identity_id", "x", "role", "member"))
                                    .with(as(newIdentity("mallory"))))
                    .andExpect(status().isNotFound());
            mockMvc.perform(
                            get("/api/v1/clusters/{id}/members", alpha)
                                    .with(as(newIdentity("mallory"))))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("two concurrent adds of the same identity: one 201, one 409")
        void concurrentDuplicateAdd() throws Exception {
            String alice = newIdentity("alice");
            String bob = newIdentity("bob");
            UUID alpha = createCluster(alice, "Alpha");
            var start = new CountDownLatch(1);

            Callable<Integer> add =
                    () -> {
                        start.await();
                        return mockMvc.perform(
                                        json(
                                                        post("/api/v1/clusters/{id}/members", alpha),
                                                        Map.of("identity_id", bob, "role", "member"))
                                                .with(as(alice)))
                                .andReturn()
                                .getResponse()
                                .getStatus();
                    };

            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                List<Future<Integer>> results = new ArrayList<>();
                results.add(pool.submit(add));
                results.add(pool.submit(add));
                start.countDown();

                List<Integer> statuses = new ArrayList<>();
                for (Future<Integer> result : results) {
                    statuses.add(result.get(30, TimeUnit.SECONDS));
                }
                assertThat(statuses).containsExactlyInAnyOrder(201, 409);
            } finally {
                pool.shutdownNow();
            }

            mockMvc.perform(get("/api/v1/clusters/{id}/members", alpha).with(as(alice)))
                    .andExpect(jsonPath("$.meta.total").value(2));
        }
    }

    @Nested
    @DisplayName("changing roles")
    class Changing {

        @Test
        @DisplayName("a member cannot promote themselves")
        void privilegeEscalationBlocked() throws Exception {
            String alice = newIdentity("alice");
            String bob = newIdentity("bob");
            UUID alpha = createCluster(alice, "Alpha");
            addMember(alice, alpha, bob, "member");

            mockMvc.perform(
                            json(
                                            patch("/api/v1/clusters/{id}/members/{m}", alpha, bob),
                                            Map.of("role", "admin"))
                                    .with(as(bob)))
                    .andExpect(status().isForbidden());
            mockMvc.perform(get("/api/v1/clusters/{id}/members", alpha)
                            .param("search", bob)
                            .with(as(alice)))
                    .andExpect(jsonPath("$.data[0].role").value("member"));
        }

        @Test
        @DisplayName("an admin cannot demote an owner")
        void adminCannotDemoteOwner() throws Exception {
            String alice = newIdentity("alice");
            String carol = newIdentity("carol");
            UUID alpha = createCluster(alice, "Alpha");
            addMember(alice, alpha, carol, "admin");

            mockMvc.perform(
                            json(
                                            patch("/api/v1/clusters/{id}/members/{m}", alpha, alice),
                                            Map.of("role", "member"))
                                    .with(as(carol)))
                    .andExpect(status().isForbidden());
        }

        @Test
        @DisplayName("the last owner cannot be demoted")
        void lastOwnerCannotBeDemoted() throws Exception {
            String alice = newIdentity("alice");
            UUID alpha = createCluster(alice, "Alpha");

            mockMvc.perform(
                            json(
                                            patch("/api/v1/clusters/{id}/members/{m}", alpha, alice),
                                            Map.of("role", "admin"))
                                    .with(as(alice)))
                    .andExpect(status().isConflict())
                    .andExpect(
                            jsonPath("$.error")
                                    .value(
                                            "Cannot demote the last owner; a cluster must keep at"
                                                    + " least one owner"));
        }

        @Test
        @DisplayName("an owner may step down once another owner exists")
        void ownerStepsDownWithCoOwner() throws Exception {
            String alice = newIdentity("alice");
            String bob = newIdentity("bob");
            UUID alpha = createCluster(alice, "Alpha");
            addMember(alice, alpha, bob, "owner");

            mockMvc.perform(
                            json(
                                            patch("/api/v1/clusters/{id}/members/{m}", alpha, alice),
                                            Map.of("role", "admin", "comment", "stepped down"))
                                    .with(as(alice)))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.role").value("admin"))
                    .andExpect(jsonPath("$.data.comment").value("stepped down"));
        }

        @Test
        @DisplayName("updating only the comment keeps the role")
        void commentOnly() throws Exception {
            String alice = newIdentity("alice");
            UUID alpha = createCluster(alice, "Alpha");

            mockMvc.perform(
                            json(
                                            patch("/api/v1/clusters/{id}/members/{m}", alpha, alice),
                                            Map.of("comment", "founder"))
                                    .with(as(alice)))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.role").value("owner"))
                    .andExpect(jsonPath("$.data.comment").value("founder"));
        }

        @Test
        @DisplayName("transfers ownership and demotes the caller to admin")
        void transferOwnership() throws Exception {
            String alice = newIdentity("alice");
            String bob = newIdentity("bob");
            UUID alpha = createCluster(alice, "Alpha");
            addMember(alice, alpha, bob, "member");

            mockMvc.perform(
                            post("/api/v1/clusters/{id}/members/{m}/ownership", alpha, bob)
                                    .with(as(alice)))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.role").value("owner"));
            mockMvc.perform(
                            get("/api/v1/clusters/{id}/members", alpha)
                                    .param("sort_by", "role")
                                    .with(as(bob)))
                    .andExpect(jsonPath("$.data[0].identity_id").value(alice))
                    .andExpect(jsonPath("$.data[0].role").value("admin"));
        }
    }

    @Nested
    @DisplayName("removing members")
    class Removing {

        @Test
        @DisplayName("the last owner cannot be removed, even by themselves")
        void lastOwnerCannotBeRemoved() throws Exception {
            String alice = newIdentity("alice");
            UUID alpha = createCluster(alice, "Alpha");

            mockMvc.perform(
                            delete("/api/v1/clusters/{id}/members/{m}", alpha, alice)
                                    .with(as(alice)))
                    .andExpect(status().isConflict());
            mockMvc.perform(get("/api/v1/clusters/{id}", alpha).with(as(alice)))
                    .andExpect(status().isOk());
        }

        @Test
        @DisplayName("an owner can leave when a co-owner remains")
        void ownerLeaves() throws Exception {
            String alice = newIdentity("alice");
            String bob = newIdentity("bob");
            UUID alpha = createCluster(alice, "Alpha");
            addMember(alice, alpha, bob, "owner");

            mockMvc.perform(
                            delete("/api/v1/clusters/{id}/members/{m}", alpha, alice)
                                    .with(as(alice)))
                    .andExpect(status().isNoContent());
            mockMvc.perform(get("/api/v1/clusters/{id}", alpha).with(as(alice)))
                    .andExpect(status().isNotFound());
            mockMvc.perform(get("/api/v1/clusters/{id}/members", alpha).with(as(bob)))
                    .andExpect(jsonPath("$.meta.total").value(1));
        }

        @Test
        @DisplayName("removing an unknown member is 404")
        void unknownMember() throws Exception {
            String alice = newIdentity("alice");
            UUID alpha = createCluster(alice, "Alpha");

            mockMvc.perform(
                            delete("/api/v1/clusters/{id}/members/{m}", alpha, "nobody")
                                    .with(as(alice)))
                    .andExpect(status().isNotFound());
        }
    }
}
