package com.strata.hierarchy.api;

import com.strata.hierarchy.api.dto.ApiResponse;
import com.strata.hierarchy.api.dto.ResourceRequest;
import com.strata.hierarchy.api.dto.ResourceResponse;
import com.strata.hierarchy.service.ResourceService;
import com.strata.security.IdentityContext;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/resources")
public class ResourceController {

    private final ResourceService resources;

    public ResourceController(ResourceService resources) {
        this.resources = resources;
    }

    @GetMapping("/{id}")
    public ApiResponse<ResourceResponse> get(
            IdentityContext identity,
            @PathVariable UUID id,
            @RequestParam(name = "include_deleted", defaultValue = "false") boolean includeDeleted) {
        return ApiResponse.ok(ResourceResponse.from(resources.get(identity, id, includeDeleted)));
    }

    @PatchMapping("/{id}")
    public ApiResponse<ResourceResponse> update(
            IdentityContext identity,
            @PathVariable UUID id,
            @Valid @RequestBody ResourceRequest request) {
        return ApiResponse.ok(
                ResourceResponse.from(resources.update(identity, id, request.toAttributes())));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(
            IdentityContext identity,
            @PathVariable UUID id,
            @RequestParam(defaultValue = "false") boolean permanent) {
        resources.delete(identity, id, permanent);
    }
}
