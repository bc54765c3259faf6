package com.lnradar.domain;

/**
 * Pay-link (LNURLp) as returned by the link listing API; used only to enrich donation summaries.
 */
public record PayLink(String id, String description, String username, String lnurl) {
}
