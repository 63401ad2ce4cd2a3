package com.geointel.reporter.model;

/**
 * Territory a point falls in, with the point reprojected in its legal SRID.
 */
public record Territory(String name, Integer srid, Double x, Double y) {
}
