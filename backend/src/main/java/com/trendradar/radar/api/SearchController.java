package com.trendradar.radar.api;

import com.trendradar.radar.model.RunRequest;
import com.trendradar.radar.service.RadarSearchService;
import com.trendradar.radar.service.RunValidationException;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class SearchController {
    private final RadarSearchService searchService;

    public SearchController(RadarSearchService searchService) {
        this.searchService = searchService;
    }

    @PostMapping("/search")
    public SearchResponse search(@RequestBody(required = false) SearchApiRequest request) {
        if (request == null) {
            throw new RunValidationException("request body is required");
        }
        if (request.generateReport() == null) {
            throw new RunValidationException("generateReport is required (true/false)");
        }
        RunRequest runRequest = new RunRequest(
            request.keywords(),
            request.filters(),
            request.platforms(),
            request.reportMode(),
            request.expandKeywords()
        );
        String label = request.userId() == null || request.userId().isBlank() ? "search" : request.userId();
        return SearchResponse.from(searchService.search(runRequest, request.generateReport(), label), null);
    }
}
