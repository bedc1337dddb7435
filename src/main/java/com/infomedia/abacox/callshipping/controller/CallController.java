package com.infomedia.abacox.callshipping.controller;

import com.infomedia.abacox.callshipping.dto.call.CallStatusDto;
import com.infomedia.abacox.callshipping.service.CallLookupService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RequiredArgsConstructor
@RestController
@Tag(name = "Call", description = "Call lookup API")
@RequestMapping("/api/call")
public class CallController {

    private final CallLookupService callLookupService;

    @GetMapping(value = "{linkedId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public CallStatusDto get(@PathVariable("linkedId") String linkedId) {
        return callLookupService.getStatus(linkedId);
    }

    @GetMapping(value = "{linkedId}/exists", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Boolean> exists(@PathVariable("linkedId") String linkedId) {
        return Map.of("exists", callLookupService.exists(linkedId));
    }
}
