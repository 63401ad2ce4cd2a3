package com.geointel.reporter.service;

import com.geointel.reporter.config.ReporterProperties.ItemDefinition;
import com.geointel.reporter.model.AdministrativeUnit;
import com.geointel.reporter.model.ClusterAssignment;
import com.geointel.reporter.model.ClusterCandidate;
import com.geointel.reporter.model.ReferenceObject;
import com.geointel.reporter.model.Territory;

import java.util.List;

/**
 * Reference geography and spatial computations. All coordinates are WGS84.
 */
public interface SpatialReferenceService {

    /**
     * Groups candidates sharing item, class and partition attribute that lie close to each other.
     * One row per candidate, ordered by cluster key (standalone rows last), then by distance to
     * the cluster centroid. Rows of one cluster are contiguous.
     */
    List<ClusterAssignment> clusterize(List<ClusterCandidate> candidates);

    /** Commune and enclosing units, null outside the covered territory. */
    AdministrativeUnit lookupAdministrativeUnit(double latitude, double longitude);

    /** Collector zone owner, never null. */
    String lookupCollector(double latitude, double longitude);

    Territory lookupTerritory(double latitude, double longitude);

    /** Closest object of the item's reference class, null when none is near enough. */
    ReferenceObject lookupReferenceObject(double latitude, double longitude, ItemDefinition item);

    /** True inside a policy-restricted zone, false outside, null when it cannot be decided. */
    Boolean isInPolicyZone(double latitude, double longitude);

    List<String> listDepartmentCodes();

    List<String> listRegionCodes();
}
