package com.trendradar.radar.fetch;

import com.trendradar.radar.model.RawItem;

import java.util.List;

/**
 * Reads one platform's ranked list for one round. Implementations must allow concurrent calls
 * for distinct platform ids.
 */
public interface PlatformFetchAdapter {

    /**
     * @throws FetchException on network or parse failure
     */
    List<RawItem> fetch(String platformId, int round);
}
