package io.healthsamurai.auditledger.model;

/**
 * Coarse location of the actor at event time.
 */
public record GeoLocation(String country, String region, String city) {}
