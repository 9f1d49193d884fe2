package com.bidscope.api;

import com.bidscope.analytics.ContractExplorerService;
import com.bidscope.domain.AggregateResult;
import com.bidscope.domain.ContractQueryRequest;
import com.bidscope.domain.ContractRecord;
import com.bidscope.domain.DimensionRow;
import com.bidscope.domain.ExportEstimate;
import com.bidscope.domain.HistogramResult;
import com.bidscope.domain.PagedResult;
import com.bidscope.export.CancellationToken;
import com.bidscope.export.ExportPipeline;
import com.bidscope.export.WriterExportSink;
import com.bidscope.query.Dimension;
import com.bidscope.query.QueryPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.BufferedWriter;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Interactive contract queries and CSV exports.
 */
@RestController
@RequestMapping("/api/v1/contracts")
public class ContractQueryController {

    private static final Logger log = LoggerFactory.getLogger(ContractQueryController.class);

    static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final ContractExplorerService explorer;
    private final ExportPipeline exportPipeline;

    public ContractQueryController(ContractExplorerService explorer, ExportPipeline exportPipeline) {
        this.explorer = explorer;
        this.exportPipeline = exportPipeline;
    }

    @PostMapping("/search")
    public PagedResult<ContractRecord> search(@RequestBody ContractQueryRequest request) {
        return explorer.execute(explorer.prepareSearch(request));
    }

    @PostMapping("/aggregates")
    public AggregateResult aggregates(@RequestBody ContractQueryRequest request) {
        return explorer.execute(explorer.prepareAggregate(request));
    }

    @PostMapping("/aggregates/paged")
    public PagedResult<DimensionRow> aggregatesPaged(@RequestBody ContractQueryRequest request) {
        return explorer.execute(explorer.prepareAggregatePaged(request));
    }

    @PostMapping("/distribution")
    public HistogramResult distribution(@RequestBody ContractQueryRequest request) {
        return explorer.execute(explorer.prepareDistribution(request));
    }

    /**
     * Contract export estimate, or the aggregated one when the request names a dimension.
     */
    @PostMapping("/export/estimate")
    public ExportEstimate exportEstimate(@RequestBody ContractQueryRequest request) {
        QueryPlan plan = explorer.prepareExportPlan(request);
        if (request.getDimension() != null && !request.getDimension().isBlank()) {
            return exportPipeline.estimateAggregated(plan, explorer.dimension(request.getDimension(), "dimension"));
        }
        return exportPipeline.estimate(plan);
    }

    @PostMapping("/export")
    public ResponseEntity<StreamingResponseBody> export(@RequestBody ContractQueryRequest request) {
        QueryPlan plan = explorer.prepareExportPlan(request);
        StreamingResponseBody body = out -> {
            Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
            try {
                exportPipeline.stream(plan, new WriterExportSink(writer), CancellationToken.none());
            } catch (UncheckedIOException e) {
                log.warn("Client stopped reading the contract export: {}", e.getMessage());
                throw e.getCause();
            }
        };
        return csv("contracts_export.csv", body);
    }

    @PostMapping("/export/aggregated")
    public ResponseEntity<StreamingResponseBody> exportAggregated(@RequestBody ContractQueryRequest request) {
        String requested = request.getDimension() == null || request.getDimension().isBlank()
            ? Dimension.CONTRACTOR.getValue()
            : request.getDimension();
        Dimension dimension = explorer.dimension(requested, "dimension");
        QueryPlan plan = explorer.prepareExportPlan(request);
        StreamingResponseBody body = out -> {
            Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
            try {
                exportPipeline.streamAggregated(plan, dimension, new WriterExportSink(writer),
                    CancellationToken.none());
            } catch (UncheckedIOException e) {
                log.warn("Client stopped reading the {} export: {}", dimension.getValue(), e.getMessage());
                throw e.getCause();
            }
        };
        return csv(dimension.getValue() + "_export.csv", body);
    }

    private static ResponseEntity<StreamingResponseBody> csv(String fileName, StreamingResponseBody body) {
        return ResponseEntity.ok()
            .contentType(TEXT_CSV)
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + fileName + "\"")
            .body(body);
    }
}
