package com.chartgate.gateway.api;

import com.chartgate.gateway.chart.ChartRecord;
import com.chartgate.gateway.chart.ChartRequest;
import com.chartgate.gateway.chart.ChartStore;
import com.chartgate.gateway.gate.Gate;
import jakarta.validation.Valid;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.util.HtmlUtils;

/**
 * Chart API. Creation passes the full gate and is charged only once the chart is stored; reads
 * are rate limited but free; embeds are public.
 */
@RestController
@RequestMapping("/v1/charts")
public class ChartController {

    public static final String API_KEY_HEADER = "X-API-Key";

    private final Gate gate;
    private final ChartStore charts;

    public ChartController(Gate gate, ChartStore charts) {
        this.gate = gate;
        this.charts = charts;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ChartResponse> create(
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey,
            @Valid @RequestBody ChartRequest request) throws Exception {
        ChartRecord chart = gate.execute(apiKey, context -> charts.create(request, context));
        return created(chart);
    }

    /** Form variant: data inline or as an uploaded file. */
    @PostMapping(consumes = {MediaType.MULTIPART_FORM_DATA_VALUE, MediaType.APPLICATION_FORM_URLENCODED_VALUE})
    public ResponseEntity<ChartResponse> upload(
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey,
            @RequestParam(value = "data", required = false) String data,
            @RequestPart(value = "file", required = false) MultipartFile file,
            @RequestParam(value = "chart_type", required = false) String chartType,
            @RequestParam(value = "title", required = false) String title) throws Exception {
        ChartRecord chart = gate.execute(apiKey, context -> {
            String content = file != null && !file.isEmpty()
                    ? new String(file.getBytes(), StandardCharsets.UTF_8)
                    : data;
            return charts.create(new ChartRequest(content, chartType, title), context);
        });
        return created(chart);
    }

    @GetMapping("/{chartId}")
    public ChartResponse get(
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey,
            @PathVariable String chartId) {
        gate.authorizeRead(apiKey);
        return ChartResponse.from(charts.get(chartId));
    }

    @GetMapping(value = "/{chartId}/embed", produces = MediaType.TEXT_HTML_VALUE)
    public String embed(@PathVariable String chartId) {
        ChartRecord chart = charts.get(chartId);
        String title = chart.title() != null ? HtmlUtils.htmlEscape(chart.title()) : "Chart";
        return "<!DOCTYPE html>\n<html><head><meta charset=\"utf-8\"><title>" + title
                + "</title></head>\n<body><figure class=\"chartgate-chart\" data-chart-id=\""
                + chart.chartId() + "\" data-chart-type=\"" + chart.chartType() + "\">"
                + "<figcaption>" + title + "</figcaption>"
                + "<pre>" + HtmlUtils.htmlEscape(chart.data()) + "</pre></figure></body></html>\n";
    }

    private static ResponseEntity<ChartResponse> created(ChartRecord chart) {
        ChartResponse body = ChartResponse.from(chart);
        return ResponseEntity.created(URI.create("/v1/charts/" + chart.chartId())).body(body);
    }
}
