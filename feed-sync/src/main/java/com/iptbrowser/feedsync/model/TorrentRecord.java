package com.iptbrowser.feedsync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * One listing row as it is cached and served.
 *
 * Identity is {@link #id}: the store never holds two records with the same id.
 * {@link #timestamp} is derived from the relative "uploaded N hours ago" text
 * at fetch time, so it is only as precise as that text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TorrentRecord {

    // ── Identity ────────────────────────────────────────────────────────────
    /** Numeric torrent id from the detail link, kept as a string */
    private String id;

    /** Category (partition) this record was listed under, e.g. "PC-ISO" */
    private String category;

    private String name;

    // ── Listing stats ───────────────────────────────────────────────────────
    /** Free-form size text as shown on the page, e.g. "3.5 GB" */
    private String size;

    private int seeders;
    private int leechers;
    private int snatched;

    // ── Time ────────────────────────────────────────────────────────────────
    /** Relative age as shown on the page, e.g. "10.9 hours ago" */
    @JsonProperty("upload_time")
    private String uploadTime;

    /** Absolute upload time resolved from uploadTime when the page was fetched */
    private LocalDateTime timestamp;

    // ── Links ───────────────────────────────────────────────────────────────
    @JsonProperty("download_link")
    private String downloadLink;

    /** Detail page */
    private String url;

    @JsonProperty("is_freeleech")
    private boolean freeleech;

    // ── Optional enrichment ─────────────────────────────────────────────────
    private Double rating;
    private Integer year;
    private List<String> genres;
    private String quality;
    private String uploader;
}
