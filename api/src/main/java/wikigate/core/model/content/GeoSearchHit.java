package wikigate.core.model.content;

/**
 * A page near a coordinate; {@code distance} is in meters.
 */
public record GeoSearchHit(long pageId, String title, double lat, double lon, double distance) {}
