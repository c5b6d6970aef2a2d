package com.autohistorian.controller;

import com.autohistorian.dto.ArticleDtos;
import com.autohistorian.service.synthesis.SynthesisService;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/** Article generation; reads the store and calls the generation backend, never writes. */
@RestController
@Tag(name = "articles")
public class ArticleController {
    private final SynthesisService synthesisService;

    public ArticleController(SynthesisService synthesisService) {
        this.synthesisService = synthesisService;
    }

    @PostMapping(value = "/topics/{name}/article", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Write an encyclopedia-style markdown article from the topic's facts")
    public Mono<ArticleDtos.Article> article(@PathVariable("name") String name,
                                            @RequestParam(name = "perspectives", defaultValue = "false") boolean perspectives) {
        return synthesisService.generateArticle(name, perspectives);
    }

    @PostMapping(value = "/topics/{name}/outline", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Article outline (title, lead, sections) as JSON")
    public Mono<JsonNode> outline(@PathVariable("name") String name) {
        return synthesisService.generateOutline(name);
    }
}
