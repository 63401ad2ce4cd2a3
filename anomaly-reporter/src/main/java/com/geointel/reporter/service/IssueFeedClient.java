package com.geointel.reporter.service;

import com.geointel.reporter.model.FeedQuery;
import com.geointel.reporter.model.IssueDetail;
import com.geointel.reporter.model.IssueDraft;

import java.util.List;

/**
 * Read access to the QA feed publishing the anomalies.
 */
public interface IssueFeedClient {

    /** Issues matching one (country, source, item, class) query. Never null. */
    List<IssueDraft> fetch(FeedQuery query);

    /** Bounding box and detection date of one false positive. */
    IssueDetail fetchDetail(String externalKey);

    /** Country names the feed accepts in queries. */
    List<String> fetchCountries();
}
