package com.iptbrowser.feedsync.model;

import java.util.List;

public record RefreshResult(List<TorrentRecord> records, CacheSummary summary) {
}
