package com.bluequee.tabconfig.api;

import com.bluequee.observability.MetricFactory;
import com.bluequee.observability.SpanHelper;
import com.bluequee.tabconfig.api.dto.CreateTabRequest;
import com.bluequee.tabconfig.api.dto.MutationResponse;
import com.bluequee.tabconfig.api.dto.ReorderRequest;
import com.bluequee.tabconfig.api.dto.TabResponse;
import com.bluequee.tabconfig.api.dto.UpdateTabRequest;
import com.bluequee.tabconfig.api.dto.VisibilityRequest;
import com.bluequee.tabconfig.domain.TabRecord;
import com.bluequee.tabconfig.domain.TabScope;
import com.bluequee.tabconfig.domain.ViewerIdentity;
import com.bluequee.tabconfig.domain.service.TabConfigService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.function.Supplier;
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

/**
 * REST transport for {@link TabConfigService}. Parses requests, runs each operation in a
 * {@code tabconfig.<operation>} span and counts successful mutations; all rules live in the
 * service.
 */
@RestController
@RequestMapping("/api/v1/tab-configs")
public class TabConfigController {

    static final String RESOLVE_TIMER = "tabconfig.resolve";
    static final String MUTATION_COUNTER = "tabconfig.mutations";

    private final TabConfigService service;
    private final SpanHelper spans;
    private final MetricFactory metrics;

    public TabConfigController(TabConfigService service, SpanHelper spans, MetricFactory metrics) {
        this.service = service;
        this.spans = spans;
        this.metrics = metrics;
    }

    @GetMapping
    public List<TabResponse> resolveTabs(ViewerIdentity viewer) {
        Supplier<List<TabRecord>> resolve =
                () -> spans.inSpan("tabconfig.resolve", () -> service.resolveTabs(viewer));
        List<TabRecord> tabs = metrics.timer(RESOLVE_TIMER, "Tab resolution latency").record(resolve);
        return tabs.stream().map(TabResponse::from).toList();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public TabResponse createCustomTab(
            @Valid @RequestBody CreateTabRequest request, ViewerIdentity caller) {
        return TabResponse.from(
                mutation("create", () -> service.createCustomTab(request.toNewTab(), caller)));
    }

    @PatchMapping("/visibility")
    public TabResponse setVisibility(
            @Valid @RequestBody VisibilityRequest request, ViewerIdentity caller) {
        if (request.key() == null || request.key().isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        return TabResponse.from(
                mutation(
                        "set_visibility",
                        () ->
                                service.setVisibility(
                                        request.key(),
                                        parseScope(request.scope()),
                                        request.visible(),
                                        caller)));
    }

    @PatchMapping("/{id}/visibility")
    public TabResponse setVisibilityById(
            @PathVariable long id, @Valid @RequestBody VisibilityRequest request, ViewerIdentity caller) {
        return TabResponse.from(
                mutation(
                        "set_visibility",
                        () ->
                                service.setVisibilityById(
                                        id, parseScope(request.scope()), request.visible(), caller)));
    }

    @PatchMapping("/reorder")
    public MutationResponse reorder(@Valid @RequestBody ReorderRequest request, ViewerIdentity caller) {
        int count = mutation("reorder", () -> service.reorder(request.toChanges(), caller));
        return new MutationResponse("Tabs reordered", count);
    }

    @PatchMapping("/{id}")
    public TabResponse updateCustomTab(
            @PathVariable long id, @RequestBody UpdateTabRequest request, ViewerIdentity caller) {
        return TabResponse.from(
                mutation("update", () -> service.updateCustomTab(id, request.toPatch(), caller)));
    }

    @DeleteMapping("/reset")
    public MutationResponse resetOverrides(
            @RequestParam(required = false) String scope, ViewerIdentity caller) {
        TabScope target = parseScope(scope);
        int deleted = mutation("reset", () -> service.resetOverrides(target, caller));
        String scopeName = (target != null ? target : TabConfigService.DEFAULT_TARGET_SCOPE).value();
        return new MutationResponse("Reset " + scopeName + " overrides", deleted);
    }

    @DeleteMapping("/{id}")
    public MutationResponse deleteCustomTab(@PathVariable long id, ViewerIdentity caller) {
        mutation(
                "delete",
                () -> {
                    service.deleteCustomTab(id, caller);
                    return null;
                });
        return new MutationResponse("Tab deleted", 1);
    }

    private <T> T mutation(String operation, Supplier<T> work) {
        T result = spans.inSpan("tabconfig." + operation, work);
        metrics.counter(MUTATION_COUNTER, "Applied tab configuration changes", "operation", operation)
                .increment();
        return result;
    }

    private static TabScope parseScope(String scope) {
        return scope == null || scope.isBlank() ? null : TabScope.parse(scope);
    }
}
