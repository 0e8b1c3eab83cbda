package com.sitecheck.core.pipeline;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class FetchedPage {
    private String url;
    private int httpStatus;
    private String contentType;
    private String body;
    private long fetchMillis;
}
