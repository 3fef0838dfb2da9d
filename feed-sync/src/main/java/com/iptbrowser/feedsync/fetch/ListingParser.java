package com.iptbrowser.feedsync.fetch;

import com.iptbrowser.feedsync.model.TorrentRecord;

import java.util.List;

/**
 * Turns the raw content of one listing page into records.
 *
 * Implementations skip rows they cannot read and must not throw on partial or
 * missing fields; an empty list means the page held no usable rows.
 */
public interface ListingParser {

    List<TorrentRecord> parse(String pageContent, String category);
}
