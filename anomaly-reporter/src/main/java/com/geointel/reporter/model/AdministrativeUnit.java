package com.geointel.reporter.model;

/**
 * Administrative units containing a point, from the reference geography.
 */
public record AdministrativeUnit(String communeCode,
                                 String communeName,
                                 String cantonCode,
                                 String arrondissementCode,
                                 String arrondissementName,
                                 String collectivityCode,
                                 String collectivityName,
                                 String departmentCode,
                                 String departmentName,
                                 String regionCode,
                                 String regionName) {
}
