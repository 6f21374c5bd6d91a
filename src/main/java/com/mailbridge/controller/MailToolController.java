package com.mailbridge.controller;

import com.mailbridge.exception.ErrorKind;
import com.mailbridge.service.MailToolService;
import com.mailbridge.service.ToolResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tool invocation REST API
 * - Invoke a tool (POST /api/tools/{operation})
 * - List tools (GET /api/tools)
 *
 * Concurrent requests storing attachments of the same message are not
 * coordinated and may race on file names.
 */
@Slf4j
@RestController
@RequestMapping("/api/tools")
@RequiredArgsConstructor
public class MailToolController {

    static final List<String> OPERATIONS = List.of(
            MailToolService.FETCH_EMAILS,
            MailToolService.SEARCH_EMAILS,
            MailToolService.SEND_EMAIL,
            MailToolService.LIST_ATTACHMENTS,
            MailToolService.GET_ATTACHMENT_INFO,
            MailToolService.READ_ATTACHMENT,
            MailToolService.GET_STORAGE_STATS,
            MailToolService.CLEANUP_ATTACHMENTS,
            MailToolService.EXTRACT_ARCHIVES,
            MailToolService.LIST_ACCOUNTS);

    private final MailToolService toolService;

    /**
     * Invoke a tool
     * POST /api/tools/fetch_emails
     * Body: { "email_address": "user@example.com", "limit": 5, "reverse_order": true }
     */
    @PostMapping("/{operation}")
    public Mono<ResponseEntity<ToolResponse>> invoke(@PathVariable String operation,
                                                     @RequestBody(required = false) Map<String, Object> arguments) {
        return toolService.invoke(operation, arguments == null ? Map.of() : arguments)
                .map(response -> ResponseEntity.status(httpStatus(response)).body(response));
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> listOperations() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("count", OPERATIONS.size());
        response.put("operations", OPERATIONS);
        return ResponseEntity.ok(response);
    }

    static HttpStatus httpStatus(ToolResponse response) {
        if (response.isSuccess()) {
            return HttpStatus.OK;
        }
        ErrorKind kind = response.getErrorKind();
        if (kind == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return switch (kind) {
            case VALIDATION_FAILURE -> HttpStatus.BAD_REQUEST;
            case CONNECTION_FAILURE -> HttpStatus.BAD_GATEWAY;
            case ATTACHMENT_FAILURE -> HttpStatus.NOT_FOUND;
            case DECODE_FAILURE, ARCHIVE_FAILURE -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    }
}
