package com.iptbrowser.feedsync.store;

import com.iptbrowser.feedsync.model.TorrentRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges record batches by id. The first record seen for an id wins; later
 * copies, from either side, are dropped and never overwrite it.
 */
@Component
public class Deduplicator {

    /**
     * @return {@code existing} followed by the {@code incoming} records whose id was not seen yet.
     *         Records without an id are dropped.
     */
    public List<TorrentRecord> merge(List<TorrentRecord> existing, List<TorrentRecord> incoming) {
        Map<String, TorrentRecord> byId = new LinkedHashMap<>();
        add(byId, existing);
        add(byId, incoming);
        return new ArrayList<>(byId.values());
    }

    private static void add(Map<String, TorrentRecord> byId, List<TorrentRecord> records) {
        if (records == null) return;
        for (TorrentRecord record : records) {
            if (record != null && record.getId() != null) {
                byId.putIfAbsent(record.getId(), record);
            }
        }
    }
}
