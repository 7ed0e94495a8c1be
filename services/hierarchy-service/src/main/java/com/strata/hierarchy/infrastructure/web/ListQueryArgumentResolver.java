package com.strata.hierarchy.infrastructure.web;

import com.strata.hierarchy.domain.ListQuery;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Builds a {@link ListQuery} from the {@code page}, {@code per_page}, {@code sort_by}, {@code
 * sort_order}, {@code search} and {@code include_deleted} query parameters.
 *
 * <p>Malformed or out-of-range values raise {@link IllegalArgumentException} (400).
 */
@Component
public class ListQueryArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return ListQuery.class.equals(parameter.getParameterType());
    }

    @Override
    public ListQuery resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest request,
            WebDataBinderFactory binderFactory) {
        int page = intParam(request, "page", 1);
        int perPage = intParam(request, "per_page", ListQuery.DEFAULT_PER_PAGE);
        String sortBy = blankToNull(request.getParameter("sort_by"));
        var sortOrder = ListQuery.SortOrder.fromValue(request.getParameter("sort_order"));
        String search = request.getParameter("search");
        boolean includeDeleted = booleanParam(request, "include_deleted");
        return new ListQuery(page, perPage, sortBy, sortOrder, search, includeDeleted);
    }

    private static int intParam(NativeWebRequest request, String name, int defaultValue) {
        String value = blankToNull(request.getParameter(name));
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer", e);
        }
    }

    private static boolean booleanParam(NativeWebRequest request, String name) {
        String value = blankToNull(request.getParameter(name));
        if (value == null) {
            return false;
        }
        return switch (value.strip()) {
            case "true", "1" -> true;
            case "false", "0" -> false;
            default -> throw new IllegalArgumentException(name + " must be true or false");
        };
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
