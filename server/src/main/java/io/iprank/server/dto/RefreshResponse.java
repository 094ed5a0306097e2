package io.iprank.server.dto;

import java.util.List;
import java.util.Map;

/** Response for POST /cron/refresh. */
public class RefreshResponse {
    public List<String> refreshed;
    public Map<String, String> failures;  // partition -> error message
}
