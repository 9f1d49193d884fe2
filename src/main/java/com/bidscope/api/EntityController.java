package com.bidscope.api;

import com.bidscope.analytics.ContractExplorerService;
import com.bidscope.domain.ContractQueryRequest;
import com.bidscope.domain.EntityAggregate;
import com.bidscope.domain.FilterOptions;
import com.bidscope.domain.PagedResult;
import com.bidscope.domain.TimeRangeRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * Entity listings, drill-downs and filter pickers. Time filtering is by whole years here;
 * richer filters go through the contract endpoints.
 */
@RestController
@RequestMapping("/api/v1")
public class EntityController {

    private final ContractExplorerService explorer;

    public EntityController(ContractExplorerService explorer) {
        this.explorer = explorer;
    }

    @GetMapping("/entities/{dimension}")
    public PagedResult<EntityAggregate> entities(
            @PathVariable String dimension,
            @RequestParam(name = "search_query", required = false) String searchQuery,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "page_size", required = false) Integer pageSize,
            @RequestParam(name = "sort_by", required = false) String sortBy,
            @RequestParam(name = "sort_direction", required = false) String sortDirection,
            @RequestParam(name = "year", required = false) List<Integer> years,
            @RequestParam(name = "include_extended_dataset", defaultValue = "false") boolean includeExtended) {
        ContractQueryRequest request = yearFilter(years, includeExtended);
        request.setPage(page);
        request.setPageSize(pageSize);
        request.setSortBy(sortBy);
        request.setSortDirection(sortDirection);
        return explorer.execute(explorer.prepareEntities(dimension, request, searchQuery));
    }

    @GetMapping("/entities/{dimension}/related")
    public List<EntityAggregate> related(
            @PathVariable String dimension,
            @RequestParam(name = "entity_value") String entityValue,
            @RequestParam(name = "target_dimension") String targetDimension,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "year", required = false) List<Integer> years,
            @RequestParam(name = "include_extended_dataset", defaultValue = "false") boolean includeExtended) {
        ContractQueryRequest request = yearFilter(years, includeExtended);
        return explorer.execute(explorer.prepareRelated(dimension, entityValue, targetDimension, limit, request));
    }

    @GetMapping("/filter-options")
    public FilterOptions filterOptions(
            @RequestParam(name = "include_extended_dataset", defaultValue = "false") boolean includeExtended) {
        return explorer.execute(explorer.prepareFilterOptions(includeExtended));
    }

    private static ContractQueryRequest yearFilter(List<Integer> years, boolean includeExtended) {
        ContractQueryRequest request = new ContractQueryRequest();
        List<TimeRangeRequest> ranges = new ArrayList<>();
        if (years != null) {
            for (Integer year : years) {
                if (year != null) {
                    ranges.add(TimeRangeRequest.yearly(year));
                }
            }
        }
        request.setTimeRanges(ranges);
        request.setIncludeExtendedDataset(includeExtended);
        return request;
    }
}
