package com.strata.hierarchy.api;

import com.strata.hierarchy.api.dto.ApiResponse;
import com.strata.hierarchy.api.dto.ClusterResponse;
import com.strata.hierarchy.api.dto.DomainResponse;
import com.strata.hierarchy.api.dto.EntityRequest;
import com.strata.hierarchy.api.dto.LinkResponse;
import com.strata.hierarchy.domain.ListQuery;
import com.strata.hierarchy.service.ClusterService;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** Clusters and the domains linked directly under them. */
@RestController
@RequestMapping("/api/v1/clusters")
public class ClusterController {

    private final ClusterService clusters;

    public ClusterController(ClusterService clusters) {
        this.clusters = clusters;
    }

    @GetMapping
    public ApiResponse<List<ClusterResponse>> list(IdentityContext identity, ListQuery query) {
        return ApiResponse.page(clusters.list(identity, query), ClusterResponse::from);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<ClusterResponse> create(
            IdentityContext identity, @Valid @RequestBody EntityRequest request) {
        return ApiResponse.ok(
                ClusterResponse.from(clusters.create(identity, request.toAttributes())));
    }

    @GetMapping("/{id}")
    public ApiResponse<ClusterResponse> get(
            IdentityContext identity,
            @PathVariable UUID id,
            @RequestParam(name = "include_deleted", defaultValue = "false") boolean includeDeleted) {
        return ApiResponse.ok(ClusterResponse.from(clusters.get(identity, id, includeDeleted)));
    }

    @PatchMapping("/{id}")
    public ApiResponse<ClusterResponse> update(
            IdentityContext identity,
            @PathVariable UUID id,
            @Valid @RequestBody EntityRequest request) {
        return ApiResponse.ok(
                ClusterResponse.from(clusters.update(identity, id, request.toAttributes())));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(
            IdentityContext identity,
            @PathVariable UUID id,
            @RequestParam(defaultValue = "false") boolean permanent) {
        clusters.delete(identity, id, permanent);
    }

    @GetMapping("/{id}/domains")
    public ApiResponse<List<DomainResponse>> listDomains(
            IdentityContext identity, @PathVariable UUID id, ListQuery query) {
        return ApiResponse.page(clusters.listDomains(identity, id, query), DomainResponse::from);
    }

    @PostMapping("/{id}/domains")
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<DomainResponse> createDomain(
            IdentityContext identity,
            @PathVariable UUID id,
            @Valid @RequestBody EntityRequest request) {
        return ApiResponse.ok(
                DomainResponse.from(clusters.createDomain(identity, id, request.toAttributes())));
    }

    @PostMapping("/{id}/domains/{domainId}")
    public ApiResponse<LinkResponse> linkDomain(
            IdentityContext identity, @PathVariable UUID id, @PathVariable UUID domainId) {
        boolean created = clusters.linkDomain(identity, id, domainId);
        return ApiResponse.ok(new LinkResponse(id, domainId, created));
    }

    @DeleteMapping("/{id}/domains/{domainId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void unlinkDomain(
            IdentityContext identity, @PathVariable UUID id, @PathVariable UUID domainId) {
        clusters.unlinkDomain(identity, id, domainId);
    }
}
