package com.furniture.queryparser.controller;

import com.furniture.queryparser.dto.HealthResponse;
import com.furniture.queryparser.dto.QueryRequest;
import com.furniture.queryparser.dto.QueryResponse;
import com.furniture.queryparser.model.ParserResult;
import com.furniture.queryparser.model.SuggestionResult;
import com.furniture.queryparser.service.FurnitureParserService;
import com.furniture.queryparser.service.QuerySuggestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Locale;

@RestController
@Tag(name = "Query", description = "Furniture query analysis and suggestion endpoints")
public class QueryController {

    private static final Logger log = LoggerFactory.getLogger(QueryController.class);

    private static final String QUERY_REQUIRED = "Query is required";

    private final FurnitureParserService furnitureParserService;
    private final QuerySuggestionService querySuggestionService;

    public QueryController(FurnitureParserService furnitureParserService,
                           QuerySuggestionService querySuggestionService) {
        this.furnitureParserService = furnitureParserService;
        this.querySuggestionService = querySuggestionService;
    }

    @Operation(
            summary = "Analyze a furniture query",
            description = "Extracts product types, features, price range and style classification " +
                    "from a free-text query, and suggests a spell-corrected query when one applies."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Query analyzed",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ParserResult.class))),
            @ApiResponse(responseCode = "400", description = "Bad request - query is null or empty", content = @Content),
            @ApiResponse(responseCode = "500", description = "Internal server error", content = @Content)
    })
    @PostMapping("/query/analyze")
    public ResponseEntity<QueryResponse<ParserResult>> analyze(@RequestBody(required = false) QueryRequest request) {
        if (request == null || !StringUtils.hasText(request.getQuery())) {
            return ResponseEntity.badRequest().body(QueryResponse.failure(QUERY_REQUIRED));
        }
        try {
            long start = System.nanoTime();
            ParserResult result = furnitureParserService.parse(request.getQuery());
            String processingTime = String.format(Locale.ROOT, "%.2f ms", (System.nanoTime() - start) / 1_000_000.0);
            log.info("Processed query in {}: {}", processingTime, request.getQuery());
            return ResponseEntity.ok(QueryResponse.ok(result, processingTime));
        } catch (RuntimeException e) {
            log.error("Error in analyze", e);
            return ResponseEntity.internalServerError().body(QueryResponse.failure("Server error: " + e.getMessage()));
        }
    }

    @Operation(
            summary = "Suggest completions for a partial query",
            description = "Returns up to ten product names, brand names and styles starting with the query, case-insensitive."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Suggestions retrieved",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = SuggestionResult.class))),
            @ApiResponse(responseCode = "400", description = "Bad request - query is null or empty", content = @Content),
            @ApiResponse(responseCode = "500", description = "Internal server error", content = @Content)
    })
    @PostMapping("/query/suggestion")
    public ResponseEntity<?> suggest(@RequestBody(required = false) QueryRequest request) {
        if (request == null || !StringUtils.hasText(request.getQuery())) {
            return ResponseEntity.badRequest().body(QueryResponse.failure(QUERY_REQUIRED));
        }
        try {
            return ResponseEntity.ok(querySuggestionService.suggest(request.getQuery()));
        } catch (RuntimeException e) {
            log.error("Error in suggest", e);
            return ResponseEntity.internalServerError().body(QueryResponse.failure("Server error: " + e.getMessage()));
        }
    }

    @Operation(summary = "Health check")
    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("healthy", Instant.now().toString(), "query-parser-api");
    }
}
