package com.strata.hierarchy.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.strata.hierarchy.domain.ListQuery;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.ServletWebRequest;

@DisplayName("ListQueryArgumentResolver")
class ListQueryArgumentResolverTest {

    private final ListQueryArgumentResolver resolver = new ListQueryArgumentResolver();

    private ListQuery resolve(MockHttpServletRequest request) {
        return resolver.resolveArgument(null, null, new ServletWebRequest(request), null);
    }

    @Test
    @DisplayName("defaults to the first page of 25, ascending, live rows only")
    void defaults() {
        ListQuery query = resolve(new MockHttpServletRequest());

        assertThat(query.page()).isEqualTo(1);
        assertThat(query.perPage()).isEqualTo(25);
        assertThat(query.sortBy()).isNull();
        assertThat(query.sortOrder()).isEqualTo(ListQuery.SortOrder.ASC);
        assertThat(query.search()).isNull();
        assertThat(query.includeDeleted()).isFalse();
    }

    @Test
    @DisplayName("reads the snake_case parameters")
    void readsParameters() {
        var request = new MockHttpServletRequest();
        request.setParameter("page", "3");
        request.setParameter("per_page", "10");
        request.setParameter("sort_by", "name");
        request.setParameter("sort_order", "DESC");
        request.setParameter("search", "alp");
        request.setParameter("include_deleted", "true");

        ListQuery query = resolve(request);

        assertThat(query.page()).isEqualTo(3);
        assertThat(query.offset()).isEqualTo(20);
        assertThat(query.sortBy()).isEqualTo("name");
        assertThat(query.sortOrder()).isEqualTo(ListQuery.SortOrder.DESC);
        assertThat(query.searchPattern()).isEqualTo("%alp%");
        assertThat(query.includeDeleted()).isTrue();
    }

    @Test
    @DisplayName("rejects non-numeric and out-of-range values")
    void rejectsBadValues() {
        var notNumber = new MockHttpServletRequest();
        notNumber.setParameter("page", "two");
        var tooBig = new MockHttpServletRequest();
        tooBig.setParameter("per_page", "500");
        var badFlag = new MockHttpServletRequest();
        badFlag.setParameter("include_deleted", "maybe");

        assertThatThrownBy(() -> resolve(notNumber))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("page must be an integer");
        assertThatThrownBy(() -> resolve(tooBig)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolve(badFlag)).isInstanceOf(IllegalArgumentException.class);
    }
}
