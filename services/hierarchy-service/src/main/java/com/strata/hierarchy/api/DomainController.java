package com.strata.hierarchy.api;

import com.strata.hierarchy.api.dto.ApiResponse;
import com.strata.hierarchy.api.dto.DomainResponse;
import com.strata.hierarchy.api.dto.EntityRequest;
import com.strata.hierarchy.api.dto.LinkResponse;
import com.strata.hierarchy.api.dto.ResourceRequest;
import com.strata.hierarchy.api.dto.ResourceResponse;
import com.strata.hierarchy.domain.ListQuery;
import com.strata.hierarchy.service.DomainService;
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

@RestController
@RequestMapping("/api/v1/domains")
public class DomainController {

    private final DomainService domains;

    public DomainController(DomainService domains) {
        this.domains = domains;
    }

    @GetMapping("/{id}")
    public ApiResponse<DomainResponse> get(
            IdentityContext identity,
            @PathVariable UUID id,
            @RequestParam(name = "include_deleted", defaultValue = "false") boolean includeDeleted) {
        return ApiResponse.ok(DomainResponse.from(domains.get(identity, id, includeDeleted)));
    }

    @PatchMapping("/{id}")
    public ApiResponse<DomainResponse> update(
            IdentityContext identity,
            @PathVariable UUID id,
            @Valid @RequestBody EntityRequest request) {
        return ApiResponse.ok(
                DomainResponse.from(domains.update(identity, id, request.toAttributes())));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(
            IdentityContext identity,
            @PathVariable UUID id,
            @RequestParam(defaultValue = "false") boolean permanent) {
        domains.delete(identity, id, permanent);
    }

    @GetMapping("/{id}/resources")
    public ApiResponse<List<ResourceResponse>> listResources(
            IdentityContext identity, @PathVariable UUID id, ListQuery query) {
        return ApiResponse.page(domains.listResources(identity, id, query), ResourceResponse::from);
    }

    @PostMapping("/{id}/resources")
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<ResourceResponse> createResource(
            IdentityContext identity,
            @PathVariable UUID id,
            @Valid @RequestBody ResourceRequest request) {
        return ApiResponse.ok(
                ResourceResponse.from(
                        domains.createResource(identity, id, request.toAttributes())));
    }

    @PostMapping("/{id}/resources/{resourceId}")
    public ApiResponse<LinkResponse> linkResource(
            IdentityContext identity, @PathVariable UUID id, @PathVariable UUID resourceId) {
        boolean created = domains.linkResource(identity, id, resourceId);
        return ApiResponse.ok(new LinkResponse(id, resourceId, created));
    }

    @DeleteMapping("/{id}/resources/{resourceId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void unlinkResource(
            IdentityContext identity, @PathVariable UUID id, @PathVariable UUID resourceId) {
        domains.unlinkResource(identity, id, resourceId);
    }
}
