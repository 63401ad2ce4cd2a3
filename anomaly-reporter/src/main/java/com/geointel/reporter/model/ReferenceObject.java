package com.geointel.reporter.model;

/**
 * Closest reference object of the item's reference class, with its configured attributes.
 */
public record ReferenceObject(String id,
                              String attribute1,
                              String attribute2,
                              String attribute3,
                              String attribute4,
                              String attribute5,
                              String modifiedAt) {
}
