package io.iprank.core;

import java.util.Optional;

/**
 * Per-partition persistence for {@link EndpointStat} records.
 * <p>
 * Semantics:
 *  - save() replaces the whole record in one write; readers never see a
 *    half-updated record.
 *  - scan() is a lazy, weakly consistent iteration over one partition.
 *    Each returned record is internally consistent; the set as a whole
 *    need not be an atomic snapshot.
 *  - Implementations signal an unreachable backend with an unchecked
 *    exception; callers decide how to surface it.
 */
public interface EndpointStatStore {

    Optional<EndpointStat> load(String partition, String endpoint);

    void save(String partition, EndpointStat stat);

    Iterable<EndpointStat> scan(String partition);
}
