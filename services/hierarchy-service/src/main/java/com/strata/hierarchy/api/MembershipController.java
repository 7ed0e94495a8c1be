package com.strata.hierarchy.api;

import com.strata.hierarchy.api.dto.ApiResponse;
import com.strata.hierarchy.api.dto.MemberRequest;
import com.strata.hierarchy.api.dto.MemberUpdateRequest;
import com.strata.hierarchy.api.dto.MembershipResponse;
import com.strata.hierarchy.domain.ListQuery;
import com.strata.hierarchy.service.MembershipRegistry;
import com.strata.hierarchy.service.MembershipService;
import com.strata.security.ClusterRole;
import com.strata.security.IdentityContext;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** Cluster memberships. Roles travel as {@code owner}, {@code admin} or {@code member}. */
@RestController
@RequestMapping("/api/v1/clusters/{clusterId}/members")
public class MembershipController {

    private final MembershipService memberships;

    public MembershipController(MembershipService memberships) {
        this.memberships = memberships;
    }

    @GetMapping
    public ApiResponse<List<MembershipResponse>> list(
            IdentityContext identity, @PathVariable UUID clusterId, ListQuery query) {
        return ApiResponse.page(
                memberships.list(identity, clusterId, query), MembershipResponse::from);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<MembershipResponse> add(
            IdentityContext identity,
            @PathVariable UUID clusterId,
            @Valid @RequestBody MemberRequest request) {
        ClusterRole role = MembershipRegistry.parseRole(request.role());
        return ApiResponse.ok(
                MembershipResponse.from(
                        memberships.add(
                                identity,
                                clusterId,
                                request.identityId(),
                                role,
                                request.comment())));
    }

    @PatchMapping("/{identityId}")
    public ApiResponse<MembershipResponse> update(
            IdentityContext identity,
            @PathVariable UUID clusterId,
            @PathVariable String identityId,
            @Valid @RequestBody MemberUpdateRequest request) {
        ClusterRole role =
                request.role() == null ? null : MembershipRegistry.parseRole(request.role());
        return ApiResponse.ok(
                MembershipResponse.from(
                        memberships.update(
                                identity, clusterId, identityId, role, request.comment())));
    }

    @DeleteMapping("/{identityId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void remove(
            IdentityContext identity,
            @PathVariable UUID clusterId,
            @PathVariable String identityId) {
        memberships.remove(identity, clusterId, identityId);
    }

    /** Makes {@code identityId} an owner and demotes the caller to admin. */
    @PostMapping("/{identityId}/ownership")
    public ApiResponse<MembershipResponse> transferOwnership(
            IdentityContext identity,
            @PathVariable UUID clusterId,
            @PathVariable String identityId) {
        return ApiResponse.ok(
                MembershipResponse.from(
                        memberships.transferOwnership(identity, clusterId, identityId)));
    }
}
