package com.infomedia.abacox.callshipping.component.aggregation;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One step of a call thread: a CDR leg or a significant CEL event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ThreadEntry {
    private Instant time;
    private String event;
    private String uniqueId;
    private String channel;
    private String dstChannel;
    private String src;
    private String dst;
    private Long duration;
    private Long billsec;
    private String disposition;
    private String lastApp;
    private String exten;
    private String context;
    private String app;
    private String appData;
    private String peer;
    private String transferee;
}
