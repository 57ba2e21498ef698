package com.citewise.controller;

import com.citewise.model.ResearchRequest;
import com.citewise.research.ResearchCommand;
import com.citewise.research.ResearchService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Research endpoint. Answers are plain text so citations and references survive any client.
 */
@Slf4j
@RestController
@RequestMapping("/v1")
public class ResearchController {

    static final String RESEARCH_FAILED_MESSAGE = "Research failed. Please try again in a moment.";

    private final ResearchService researchService;

    public ResearchController(ResearchService researchService) {
        this.researchService = researchService;
    }

    /**
     * Run one research invocation. The mode comes from the body, or from
     * --quick / --deep flags inside the query when the body has none.
     */
    @PostMapping(value = "/research",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<ResponseEntity<String>> research(@RequestBody ResearchRequest request) {
        ResearchCommand command = ResearchCommand.parse(request.getQuery());
        if (command.isEmpty()) {
            return Mono.just(ResponseEntity.badRequest().body(ResearchCommand.USAGE));
        }

        String mode = request.getMode() != null && !request.getMode().isBlank()
                ? request.getMode()
                : command.mode();

        log.info("Received research request: mode={}, query='{}'", mode, command.query());

        return researchService.research(command.query(), mode)
                .map(ResponseEntity::ok)
                .onErrorResume(error -> {
                    log.error("Research error for query '{}'", command.query(), error);
                    return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                            .body(RESEARCH_FAILED_MESSAGE));
                });
    }
}
