package io.iprank.server.dto;

import java.util.List;

/** GET /api/candidates response; also the on-disk candidate pool format. */
public class CandidatesResponse {
    public List<String> candidates;
}
