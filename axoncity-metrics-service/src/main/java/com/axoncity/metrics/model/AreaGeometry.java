package com.axoncity.metrics.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;
import org.locationtech.jts.io.geojson.GeoJsonWriter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * A drawn area as a JTS {@link Polygon} or {@link MultiPolygon} in WGS84 lon/lat, read from and
 * written as GeoJSON. Rings must be closed, as GeoJSON requires.
 */
@JsonSerialize(using = AreaGeometry.GeoJsonSerializer.class)
@JsonDeserialize(using = AreaGeometry.GeoJsonDeserializer.class)
public record AreaGeometry(Geometry geometry) {

    public AreaGeometry {
        if (!(geometry instanceof Polygon) && !(geometry instanceof MultiPolygon)) {
            throw new IllegalArgumentException("Unsupported geometry type: "
                    + (geometry == null ? null : geometry.getGeometryType()));
        }
        if (geometry.isEmpty()) {
            throw new IllegalArgumentException("Geometry has no polygons");
        }
    }

    public static AreaGeometry fromGeoJson(String geoJson) {
        try {
            return new AreaGeometry(new GeoJsonReader().read(geoJson));
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid GeoJSON geometry: " + e.getMessage(), e);
        }
    }

    public String toGeoJson() {
        GeoJsonWriter writer = new GeoJsonWriter();
        writer.setEncodeCRS(false);
        return writer.write(geometry);
    }

    public String type() {
        return geometry.getGeometryType();
    }

    /**
     * The member polygons; a single {@code Polygon} yields a list of one.
     */
    public List<Polygon> polygons() {
        List<Polygon> polygons = new ArrayList<>(geometry.getNumGeometries());
        for (int i = 0; i < geometry.getNumGeometries(); i++) {
            polygons.add((Polygon) geometry.getGeometryN(i));
        }
        return polygons;
    }

    public static class GeoJsonSerializer extends JsonSerializer<AreaGeometry> {

        @Override
        public void serialize(AreaGeometry value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeRawValue(value.toGeoJson());
        }
    }

    public static class GeoJsonDeserializer extends JsonDeserializer<AreaGeometry> {

        @Override
        public AreaGeometry deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = p.readValueAsTree();
            try {
                return fromGeoJson(node.toString());
            } catch (IllegalArgumentException e) {
                // JTS reports open or short rings as IllegalArgumentException too
                throw JsonMappingException.from(p, e.getMessage(), e);
            }
        }
    }
}
